/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

import com.semroute.domain.model.CircuitState;
import com.semroute.domain.model.HealthStatus;
import com.semroute.domain.model.ProviderId;

import java.time.Instant;

/**
 * Read-only view of one provider's runtime state at ranking time. {@code circuitState} is the
 * effective state: an open circuit whose cooldown has elapsed shows up as HALF_OPEN.
 */
public record ProviderSnapshot(
        ProviderId provider,
        CircuitState circuitState,
        HealthStatus healthStatus,
        double latencyEwmaMillis,
        boolean hasLatency,
        int consecutiveFailures,
        Instant lastObservedAt
) {}
