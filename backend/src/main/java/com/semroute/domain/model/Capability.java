/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.domain.model;

import java.util.Locale;

public enum Capability {
    EMBEDDING,
    VECTOR_STORE;

    /** Accepts {@code embedding}, {@code vector-store}, {@code VECTOR_STORE}... */
    public static Capability fromPath(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Capability must not be blank");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (Capability c : values()) {
            if (c.name().equals(normalized)) return c;
        }
        throw new IllegalArgumentException("Unknown capability: " + value);
    }

    public String pathName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
