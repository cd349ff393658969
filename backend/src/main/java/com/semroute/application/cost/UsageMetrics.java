/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.cost;

import java.time.Instant;

public record UsageMetrics(
        long totalUnits,
        double totalCost,
        long currentPeriodUnits,
        double currentPeriodCost,
        long operationCount,
        Instant lastUsage
) {
    public static UsageMetrics empty() {
        return new UsageMetrics(0, 0, 0, 0, 0, null);
    }

    public double averageCostPerUnit() {
        return totalUnits == 0 ? 0 : totalCost / totalUnits;
    }

    UsageMetrics add(long units, double cost, Instant at) {
        return new UsageMetrics(
                totalUnits + units,
                totalCost + cost,
                currentPeriodUnits + units,
                currentPeriodCost + cost,
                operationCount + 1,
                at
        );
    }

    UsageMetrics newPeriod() {
        return new UsageMetrics(totalUnits, totalCost, 0, 0, operationCount, lastUsage);
    }
}
