/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.infrastructure.metrics;

import com.semroute.application.routing.AttemptOutcome;
import com.semroute.application.routing.AttemptRecord;
import com.semroute.application.routing.RoutingObserver;
import com.semroute.application.routing.RoutingReport;
import org.springframework.stereotype.Component;

@Component
public class MetricsRoutingObserver implements RoutingObserver {
    private final RoutingMetrics metrics;

    public MetricsRoutingObserver(RoutingMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onRoutingCompleted(RoutingReport report) {
        metrics.recordRequest(report.capability().name().toLowerCase(), report.outcome().name().toLowerCase(), report.elapsed());
        for (AttemptRecord attempt : report.attempts()) {
            if (!attempt.dispatched()) continue;
            metrics.recordAttempt(attempt.provider(), attempt.outcome().name().toLowerCase(), attempt.latencyMillis());
            if (attempt.outcome() == AttemptOutcome.FAILED || attempt.outcome() == AttemptOutcome.TIMEOUT) {
                metrics.recordError(attempt.provider(), attempt.errorType() == null ? "UNKNOWN" : attempt.errorType().name());
            }
        }
        if (report.chosen() != null) {
            metrics.recordSelection(report.chosen());
            metrics.recordCost(report.chosen(), report.cost());
        }
    }
}
