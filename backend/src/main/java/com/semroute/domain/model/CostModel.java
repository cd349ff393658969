/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.domain.model;

import java.util.Map;

/**
 * Declared price of a provider. {@code budget} is per billing period and may be null (no limit).
 */
public record CostModel(
        double costPerUnit,
        String unitType,
        long freeTierUnits,
        String currency,
        Double budget
) {
    public static final String DEFAULT_UNIT_TYPE = "request";
    public static final String DEFAULT_CURRENCY = "USD";

    // Reasonable upper bound per unit type; anything at or above it scores 0 efficiency.
    private static final Map<String, Double> MAX_REASONABLE_COST = Map.of(
            "token", 0.0001,
            "request", 1.0,
            "GB", 1.0,
            "second", 0.1
    );
    private static final double DEFAULT_MAX_REASONABLE_COST = 1.0;

    public CostModel {
        if (costPerUnit < 0) {
            throw new IllegalArgumentException("costPerUnit must be >= 0");
        }
        if (freeTierUnits < 0) {
            throw new IllegalArgumentException("freeTierUnits must be >= 0");
        }
        if (budget != null && budget < 0) {
            throw new IllegalArgumentException("budget must be >= 0");
        }
        unitType = unitType == null || unitType.isBlank() ? DEFAULT_UNIT_TYPE : unitType;
        currency = currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency.toUpperCase();
    }

    public static CostModel free() {
        return new CostModel(0, DEFAULT_UNIT_TYPE, 0, DEFAULT_CURRENCY, null);
    }

    /**
     * Cost of one call. The free tier is applied to the call itself, not to the running total.
     */
    public double costOf(long units) {
        if (units <= 0) return 0;
        if (freeTierUnits > 0) {
            return units <= freeTierUnits ? 0 : (units - freeTierUnits) * costPerUnit;
        }
        return units * costPerUnit;
    }

    /** 0.0 = expensive, 1.0 = free. */
    public double efficiencyScore() {
        double max = MAX_REASONABLE_COST.getOrDefault(unitType, DEFAULT_MAX_REASONABLE_COST);
        return (max - Math.min(costPerUnit, max)) / max;
    }
}
