/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

/**
 * Hook called once per routed request, whatever the outcome. Must not block; exceptions are
 * logged and otherwise ignored so an observer can never fail a request.
 */
public interface RoutingObserver {
    void onRoutingCompleted(RoutingReport report);
}
