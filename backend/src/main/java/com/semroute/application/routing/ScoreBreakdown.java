/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

import com.semroute.domain.model.CircuitState;
import com.semroute.domain.model.HealthStatus;

/**
 * Inputs and partial scores behind one candidate's total, kept for logs and the admin API.
 */
public record ScoreBreakdown(
        double totalScore,
        double declaredQuality,
        double qualityPenalty,
        double qualityScore,
        double latencyScore,
        double loadScore,
        double preferenceScore,
        double costScore,
        HealthStatus healthStatus,
        CircuitState circuitState,
        double latencyEwmaMillis,
        int inFlight
) {}
