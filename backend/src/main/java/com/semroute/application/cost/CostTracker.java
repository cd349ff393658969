/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.cost;

import com.semroute.application.ProviderRegistry;
import com.semroute.domain.model.CostModel;
import com.semroute.domain.model.ProviderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Usage and spend per provider, against the declared {@link CostModel}.
 *
 * <p>Budgets come from the cost model and can be overridden at runtime. When enforcement is on,
 * the router skips providers whose current-period spend exceeds their budget.
 */
public class CostTracker {
    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);

    private final ProviderRegistry registry;
    private final Clock clock;
    private final boolean enforceBudgets;
    private final Map<ProviderId, UsageMetrics> usage = new ConcurrentHashMap<>();
    private final Map<ProviderId, Double> budgetOverrides = new ConcurrentHashMap<>();

    public CostTracker(ProviderRegistry registry, Clock clock, boolean enforceBudgets) {
        this.registry = registry;
        this.clock = clock;
        this.enforceBudgets = enforceBudgets;
    }

    /**
     * Records one operation and returns what it cost.
     */
    public double recordUsage(ProviderId provider, long units) {
        if (units < 0) {
            throw new IllegalArgumentException("units must be >= 0");
        }
        CostModel model = registry.descriptor(provider).cost();
        double cost = model.costOf(units);
        Instant now = clock.instant();
        UsageMetrics updated = usage.merge(provider, UsageMetrics.empty().add(units, cost, now),
                (current, ignored) -> current.add(units, cost, now));

        Double budget = budget(provider).orElse(null);
        if (budget != null && updated.currentPeriodCost() > budget) {
            log.warn("Budget exceeded provider={} spent={} budget={} currency={}",
                    provider, updated.currentPeriodCost(), budget, model.currency());
        }
        return cost;
    }

    public Optional<UsageMetrics> usage(ProviderId provider) {
        return Optional.ofNullable(usage.get(provider));
    }

    public Map<ProviderId, UsageMetrics> allUsage() {
        return Map.copyOf(usage);
    }

    public void setBudget(ProviderId provider, double budget) {
        if (budget < 0) {
            throw new IllegalArgumentException("budget must be >= 0");
        }
        registry.descriptor(provider);
        budgetOverrides.put(provider, budget);
    }

    public Optional<Double> budget(ProviderId provider) {
        Double override = budgetOverrides.get(provider);
        if (override != null) return Optional.of(override);
        return registry.find(provider).map(d -> d.cost().budget());
    }

    /** Always true when budgets are not enforced. */
    public boolean withinBudget(ProviderId provider) {
        if (!enforceBudgets) return true;
        Double budget = budget(provider).orElse(null);
        if (budget == null) return true;
        UsageMetrics metrics = usage.get(provider);
        return metrics == null || metrics.currentPeriodCost() <= budget;
    }

    public boolean enforcesBudgets() {
        return enforceBudgets;
    }

    public double efficiencyScore(ProviderId provider) {
        return registry.descriptor(provider).cost().efficiencyScore();
    }

    public double totalCost() {
        return usage.values().stream().mapToDouble(UsageMetrics::totalCost).sum();
    }

    public double currentPeriodCost() {
        return usage.values().stream().mapToDouble(UsageMetrics::currentPeriodCost).sum();
    }

    /** Starts a new billing period: period counters go to zero, totals are kept. */
    public void resetPeriod() {
        usage.replaceAll((id, metrics) -> metrics.newPeriod());
        log.info("Cost period reset providers={}", usage.size());
    }
}
