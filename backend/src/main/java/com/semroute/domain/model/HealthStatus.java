/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.domain.model;

/**
 * Reachability view of a provider. Demotion is gradual: HEALTHY first drops to DEGRADED
 * and only reaches UNHEALTHY after the configured number of consecutive failures.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    UNKNOWN;

    /** One step down, used by the staleness watchdog. UNKNOWN and UNHEALTHY stay put. */
    public HealthStatus demoteOneNotch() {
        return switch (this) {
            case HEALTHY -> DEGRADED;
            case DEGRADED -> UNHEALTHY;
            case UNHEALTHY, UNKNOWN -> this;
        };
    }
}
