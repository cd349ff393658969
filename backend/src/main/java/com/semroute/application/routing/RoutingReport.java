/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

import com.semroute.domain.model.Capability;
import com.semroute.domain.model.ProviderId;

import java.time.Duration;
import java.util.List;

/**
 * Summary of one routed request, delivered to every {@link RoutingObserver}.
 *
 * @param chosen     winning provider, null unless {@code outcome} is SUCCESS
 * @param breakdown  score breakdown of the winner, null unless SUCCESS
 * @param excluded   providers the router left out (open circuit, over budget)
 * @param stopReason why the walk ended early, null when candidates simply ran out
 */
public record RoutingReport(
        Capability capability,
        Outcome outcome,
        ProviderId chosen,
        ScoreBreakdown breakdown,
        List<AttemptRecord> attempts,
        List<ProviderId> excluded,
        Duration elapsed,
        String stopReason,
        double cost
) {
    public enum Outcome {
        SUCCESS,
        ALL_FAILED,
        CANCELLED
    }

    public RoutingReport {
        attempts = List.copyOf(attempts);
        excluded = List.copyOf(excluded);
    }

    public long dispatchedAttempts() {
        return attempts.stream().filter(AttemptRecord::dispatched).count();
    }
}
