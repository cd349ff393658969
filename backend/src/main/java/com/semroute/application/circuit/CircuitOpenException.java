/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.circuit;

import com.semroute.application.RoutingException;
import com.semroute.domain.model.ProviderId;

import java.time.Instant;

public class CircuitOpenException extends RoutingException {
    private final ProviderId provider;
    private final Instant retryAt;

    public CircuitOpenException(ProviderId provider, Instant retryAt) {
        super("Circuit open for " + provider + (retryAt == null ? "" : ", retry at " + retryAt));
        this.provider = provider;
        this.retryAt = retryAt;
    }

    public ProviderId provider() {
        return provider;
    }

    public Instant retryAt() {
        return retryAt;
    }

    @Override
    public String code() {
        return "CIRCUIT_OPEN";
    }
}
