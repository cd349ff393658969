/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable health view of one provider. Every transition returns a new instance so the
 * state store can swap it atomically; readers never observe a half-applied update.
 *
 * @param latencyEwmaMillis smoothed latency of successful observations, 0 until the first sample
 * @param lastProbeAt       last scheduled probe, null until the first one completes
 * @param lastObservedAt    last probe or real call outcome; drives the staleness watchdog
 * @param staleDemotedAt    last time the watchdog demoted this record, null when fresh
 */
public record HealthRecord(
        HealthStatus status,
        int consecutiveSuccesses,
        int consecutiveFailures,
        double latencyEwmaMillis,
        long latencySamples,
        Instant lastProbeAt,
        Instant lastObservedAt,
        Instant staleDemotedAt,
        String lastError
) {
    public static HealthRecord unknown() {
        return new HealthRecord(HealthStatus.UNKNOWN, 0, 0, 0, 0, null, null, null, null);
    }

    public boolean hasLatency() {
        return latencySamples > 0;
    }

    public HealthRecord recordSuccess(double latencyMillis, Instant at, boolean probe, int successThreshold, double ewmaAlpha) {
        int successes = saturatingIncrement(consecutiveSuccesses);
        double sample = Math.max(0, latencyMillis);
        double ewma = latencySamples == 0 ? sample : ewmaAlpha * sample + (1 - ewmaAlpha) * latencyEwmaMillis;

        HealthStatus next = status;
        if (status != HealthStatus.HEALTHY && successes >= successThreshold) {
            next = HealthStatus.HEALTHY;
        }
        return new HealthRecord(
                next,
                successes,
                0,
                ewma,
                latencySamples + 1,
                probe ? at : lastProbeAt,
                at,
                null,
                lastError
        );
    }

    public HealthRecord recordFailure(String error, Instant at, boolean probe, int failThreshold) {
        int failures = saturatingIncrement(consecutiveFailures);
        HealthStatus next = switch (status) {
            // a single blip never takes a healthy provider straight to UNHEALTHY
            case HEALTHY -> HealthStatus.DEGRADED;
            case DEGRADED, UNKNOWN -> failures >= failThreshold ? HealthStatus.UNHEALTHY : HealthStatus.DEGRADED;
            case UNHEALTHY -> HealthStatus.UNHEALTHY;
        };
        return new HealthRecord(
                next,
                0,
                failures,
                latencyEwmaMillis,
                latencySamples,
                probe ? at : lastProbeAt,
                at,
                null,
                error
        );
    }

    /**
     * Demotes one notch when nothing has been observed for {@code maxAge}. A record is demoted
     * at most once per {@code maxAge} window so a silent provider walks down gradually.
     */
    public HealthRecord demoteIfStale(Instant now, Duration maxAge) {
        if (lastObservedAt == null || status == HealthStatus.UNKNOWN || status == HealthStatus.UNHEALTHY) {
            return this;
        }
        Instant reference = staleDemotedAt != null && staleDemotedAt.isAfter(lastObservedAt) ? staleDemotedAt : lastObservedAt;
        if (Duration.between(reference, now).compareTo(maxAge) <= 0) {
            return this;
        }
        return new HealthRecord(
                status.demoteOneNotch(),
                consecutiveSuccesses,
                consecutiveFailures,
                latencyEwmaMillis,
                latencySamples,
                lastProbeAt,
                lastObservedAt,
                now,
                "stale: no observation since " + lastObservedAt
        );
    }

    private static int saturatingIncrement(int value) {
        return value == Integer.MAX_VALUE ? value : value + 1;
    }
}
