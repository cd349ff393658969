/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application;

/**
 * Base of every failure the routing engine reports to its callers. {@link #code()} is stable
 * and safe to expose in API responses.
 */
public abstract class RoutingException extends RuntimeException {
    protected RoutingException(String message) {
        super(message);
    }

    protected RoutingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String code();
}
