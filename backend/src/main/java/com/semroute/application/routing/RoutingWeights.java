/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

/**
 * Blend of the ranking signals. All weights are non-negative and sum to 1 so that every score
 * stays within [0, 1].
 */
public record RoutingWeights(
        double quality,
        double latency,
        double load,
        double preference,
        double cost
) {
    public static final double DEFAULT_QUALITY = 0.6;
    public static final double DEFAULT_LATENCY = 0.3;
    public static final double DEFAULT_LOAD = 0.1;
    public static final double DEFAULT_PREFERENCE = 0.0;
    public static final double DEFAULT_COST = 0.0;

    private static final double SUM_TOLERANCE = 1e-6;

    public RoutingWeights {
        requireNonNegative("quality", quality);
        requireNonNegative("latency", latency);
        requireNonNegative("load", load);
        requireNonNegative("preference", preference);
        requireNonNegative("cost", cost);
        double sum = quality + latency + load + preference + cost;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Routing weights must sum to 1, got " + sum);
        }
    }

    public static RoutingWeights defaults() {
        return new RoutingWeights(DEFAULT_QUALITY, DEFAULT_LATENCY, DEFAULT_LOAD, DEFAULT_PREFERENCE, DEFAULT_COST);
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Routing weight " + name + " must be >= 0, got " + value);
        }
    }
}
