/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

import com.semroute.domain.model.ProviderId;

import java.time.Duration;
import java.util.List;

/**
 * Successful routing: the response plus how it was obtained.
 *
 * @param cost what the winning call cost according to the provider's cost model
 */
public record RoutingResult<R>(
        R response,
        RankedCandidate chosen,
        List<AttemptRecord> attempts,
        Duration elapsed,
        double cost
) {
    public RoutingResult {
        attempts = List.copyOf(attempts);
    }

    public ProviderId provider() {
        return chosen.provider();
    }

    public ScoreBreakdown breakdown() {
        return chosen.breakdown();
    }
}
