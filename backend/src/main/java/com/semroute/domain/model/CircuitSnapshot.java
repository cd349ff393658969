/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable circuit breaker state of one provider.
 *
 * <p>{@code generation} changes on every state transition. Permits carry the generation they were
 * issued in, so an outcome that arrives after the circuit has moved on cannot drive a later state.
 */
public record CircuitSnapshot(
        CircuitState state,
        int failureCount,
        int consecutiveOpens,
        Instant openedAt,
        Duration cooldown,
        boolean halfOpenProbeInFlight,
        long generation
) {
    public static CircuitSnapshot closed() {
        return new CircuitSnapshot(CircuitState.CLOSED, 0, 0, null, Duration.ZERO, false, 0);
    }

    public boolean cooldownElapsed(Instant now) {
        return openedAt != null && !now.isBefore(openedAt.plus(cooldown));
    }

    public Instant retryAt() {
        return openedAt == null ? null : openedAt.plus(cooldown);
    }

    /** OPEN whose cooldown has elapsed is reported as HALF_OPEN; it will admit the next caller. */
    public CircuitState effectiveState(Instant now) {
        if (state == CircuitState.OPEN && !halfOpenProbeInFlight && cooldownElapsed(now)) {
            return CircuitState.HALF_OPEN;
        }
        return state;
    }

    public CircuitSnapshot withFailureCount(int count) {
        return new CircuitSnapshot(state, count, consecutiveOpens, openedAt, cooldown, halfOpenProbeInFlight, generation);
    }

    public CircuitSnapshot open(Instant now, int opens, Duration newCooldown) {
        return new CircuitSnapshot(CircuitState.OPEN, 0, opens, now, newCooldown, false, generation + 1);
    }

    public CircuitSnapshot halfOpenWithProbe() {
        return new CircuitSnapshot(CircuitState.HALF_OPEN, failureCount, consecutiveOpens, openedAt, cooldown, true, generation + 1);
    }

    public CircuitSnapshot withProbeReleased() {
        return new CircuitSnapshot(state, failureCount, consecutiveOpens, openedAt, cooldown, false, generation);
    }

    public CircuitSnapshot close() {
        return new CircuitSnapshot(CircuitState.CLOSED, 0, 0, null, Duration.ZERO, false, generation + 1);
    }
}
