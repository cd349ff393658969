/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

import com.semroute.domain.model.ProviderId;
import com.semroute.infrastructure.backend.BackendErrorType;

/**
 * One entry of the attempt log.
 *
 * @param attempt   1-based dispatch number, 0 for candidates skipped without a call
 * @param errorType null unless the backend call itself failed
 */
public record AttemptRecord(
        int attempt,
        ProviderId provider,
        double score,
        AttemptOutcome outcome,
        long latencyMillis,
        BackendErrorType errorType,
        String error
) {
    public AttemptRecord {
        if (provider == null || outcome == null) {
            throw new IllegalArgumentException("provider and outcome are required");
        }
        if (attempt < 0 || latencyMillis < 0) {
            throw new IllegalArgumentException("attempt and latencyMillis must be >= 0");
        }
    }

    static AttemptRecord success(int attempt, RankedCandidate candidate, long latencyMillis) {
        return new AttemptRecord(attempt, candidate.provider(), candidate.score(), AttemptOutcome.SUCCESS, latencyMillis, null, null);
    }

    static AttemptRecord failed(int attempt, RankedCandidate candidate, long latencyMillis, BackendErrorType type, String error) {
        AttemptOutcome outcome = type == BackendErrorType.TIMEOUT ? AttemptOutcome.TIMEOUT : AttemptOutcome.FAILED;
        return new AttemptRecord(attempt, candidate.provider(), candidate.score(), outcome, latencyMillis, type, error);
    }

    static AttemptRecord circuitOpen(RankedCandidate candidate, String detail) {
        return new AttemptRecord(0, candidate.provider(), candidate.score(), AttemptOutcome.CIRCUIT_OPEN, 0, null, detail);
    }

    static AttemptRecord cancelled(int attempt, RankedCandidate candidate, long latencyMillis, String reason) {
        return new AttemptRecord(attempt, candidate.provider(), candidate.score(), AttemptOutcome.CANCELLED, latencyMillis, null, reason);
    }

    public boolean dispatched() {
        return attempt > 0;
    }

    /** Short human-readable form used in exception messages. */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(attempt == 0 ? "-" : String.valueOf(attempt)).append("] ")
                .append(provider).append(' ').append(outcome);
        if (attempt > 0) sb.append(" after ").append(latencyMillis).append("ms");
        if (error != null) sb.append(": ").append(error);
        return sb.toString();
    }
}
