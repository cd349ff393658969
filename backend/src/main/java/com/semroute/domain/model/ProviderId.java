/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.domain.model;

import java.util.Objects;

public record ProviderId(Capability capability, String name) {
    public ProviderId {
        Objects.requireNonNull(capability, "capability");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        name = name.trim();
    }

    public static ProviderId of(Capability capability, String name) {
        return new ProviderId(capability, name);
    }

    @Override
    public String toString() {
        return capability.name().toLowerCase() + ":" + name;
    }
}
