/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.domain.model;

import java.util.Objects;

/**
 * Static, immutable description of one backend instance. Created once at startup.
 *
 * @param id      capability + unique name
 * @param weight  static preference weight, strictly positive
 * @param quality declared quality score in [0, 1]
 * @param cost    declared cost unit
 */
public record ProviderDescriptor(
        ProviderId id,
        double weight,
        double quality,
        CostModel cost
) {
    public ProviderDescriptor {
        Objects.requireNonNull(id, "id");
        if (!(weight > 0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Provider " + id + " weight must be > 0, got " + weight);
        }
        if (!(quality >= 0 && quality <= 1)) {
            throw new IllegalArgumentException("Provider " + id + " quality must be within [0,1], got " + quality);
        }
        cost = cost == null ? CostModel.free() : cost;
    }

    public Capability capability() {
        return id.capability();
    }

    public String name() {
        return id.name();
    }
}
