/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

import com.semroute.application.RoutingException;
import com.semroute.domain.model.Capability;
import com.semroute.domain.model.ProviderId;

import java.util.List;
import java.util.stream.Collectors;

public class AllProvidersFailedException extends RoutingException {
    private final Capability capability;
    private final List<AttemptRecord> attempts;
    private final List<ProviderId> excluded;
    private final String stopReason;

    public AllProvidersFailedException(Capability capability, List<AttemptRecord> attempts, List<ProviderId> excluded, String stopReason) {
        super(buildMessage(capability, attempts, excluded, stopReason));
        this.capability = capability;
        this.attempts = List.copyOf(attempts);
        this.excluded = List.copyOf(excluded);
        this.stopReason = stopReason;
    }

    public Capability capability() {
        return capability;
    }

    public List<AttemptRecord> attempts() {
        return attempts;
    }

    public List<ProviderId> excluded() {
        return excluded;
    }

    public String stopReason() {
        return stopReason;
    }

    @Override
    public String code() {
        return "ALL_PROVIDERS_FAILED";
    }

    private static String buildMessage(Capability capability, List<AttemptRecord> attempts, List<ProviderId> excluded, String stopReason) {
        StringBuilder sb = new StringBuilder("All providers failed for ").append(capability);
        long dispatched = attempts.stream().filter(AttemptRecord::dispatched).count();
        sb.append(" (").append(dispatched).append(dispatched == 1 ? " attempt" : " attempts").append(')');
        if (stopReason != null) sb.append(", stopped: ").append(stopReason);
        if (!attempts.isEmpty()) {
            sb.append(": ").append(attempts.stream().map(AttemptRecord::summary).collect(Collectors.joining("; ")));
        }
        if (!excluded.isEmpty()) {
            sb.append("; not eligible: ").append(excluded);
        }
        return sb.toString();
    }
}
