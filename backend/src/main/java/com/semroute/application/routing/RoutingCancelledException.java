/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

import com.semroute.application.RoutingException;
import com.semroute.domain.model.Capability;

import java.util.List;

public class RoutingCancelledException extends RoutingException {
    private final Capability capability;
    private final List<AttemptRecord> attempts;
    private final String reason;

    public RoutingCancelledException(Capability capability, List<AttemptRecord> attempts, String reason) {
        super("Routing for " + capability + " cancelled: " + reason);
        this.capability = capability;
        this.attempts = List.copyOf(attempts);
        this.reason = reason;
    }

    public Capability capability() {
        return capability;
    }

    public List<AttemptRecord> attempts() {
        return attempts;
    }

    public String reason() {
        return reason;
    }

    @Override
    public String code() {
        return "ROUTING_CANCELLED";
    }
}
