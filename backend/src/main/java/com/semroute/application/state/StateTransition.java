/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.state;

/**
 * Result of an atomic update: the value that was replaced and the value now stored.
 */
public record StateTransition<T>(T before, T after) {
    public boolean changed() {
        return before != after;
    }
}
