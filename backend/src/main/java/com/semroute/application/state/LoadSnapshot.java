/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.state;

import com.semroute.domain.model.ProviderId;

import java.util.Map;

/**
 * Point-in-time copy of the in-flight counters used for one ranking.
 */
public record LoadSnapshot(Map<ProviderId, Integer> inFlight) {
    public LoadSnapshot {
        inFlight = inFlight == null ? Map.of() : Map.copyOf(inFlight);
    }

    public static LoadSnapshot empty() {
        return new LoadSnapshot(Map.of());
    }

    public int inFlight(ProviderId provider) {
        return inFlight.getOrDefault(provider, 0);
    }
}
