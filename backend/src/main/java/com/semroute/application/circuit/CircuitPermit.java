/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.circuit;

import com.semroute.domain.model.ProviderId;

import java.time.Instant;

/**
 * Answer of {@link CircuitBreaker#tryAcquire}. A granted permit must be reported back exactly
 * once through {@code onSuccess}, {@code onFailure} or {@code release}.
 *
 * @param generation circuit generation the permit was issued in
 * @param retryAt    for rejected permits, when the circuit may admit a probe again
 */
public record CircuitPermit(ProviderId provider, Kind kind, long generation, Instant retryAt) {
    public enum Kind {
        /** Normal call through a closed circuit. */
        ADMITTED,
        /** The single trial call of a half-open circuit. */
        PROBE,
        REJECTED
    }

    static CircuitPermit admitted(ProviderId provider, long generation) {
        return new CircuitPermit(provider, Kind.ADMITTED, generation, null);
    }

    static CircuitPermit probe(ProviderId provider, long generation) {
        return new CircuitPermit(provider, Kind.PROBE, generation, null);
    }

    static CircuitPermit rejected(ProviderId provider, long generation, Instant retryAt) {
        return new CircuitPermit(provider, Kind.REJECTED, generation, retryAt);
    }

    public boolean granted() {
        return kind != Kind.REJECTED;
    }

    public boolean isProbe() {
        return kind == Kind.PROBE;
    }

    /** Turns a rejection into the exception callers outside the coordinator expect. */
    public CircuitOpenException toException() {
        return new CircuitOpenException(provider, retryAt);
    }
}
