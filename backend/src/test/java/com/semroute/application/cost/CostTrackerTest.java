/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.cost;

import com.semroute.application.ProviderRegistry;
import com.semroute.domain.model.Capability;
import com.semroute.domain.model.CostModel;
import com.semroute.domain.model.ProviderDescriptor;
import com.semroute.domain.model.ProviderId;
import com.semroute.support.MutableClock;
import com.semroute.support.ScriptedBackendClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CostTrackerTest {
    private static final ProviderId OPENAI = ProviderId.of(Capability.EMBEDDING, "openai");
    private static final ProviderId LOCAL = ProviderId.of(Capability.EMBEDDING, "local");

    private final MutableClock clock = MutableClock.startingAt("2025-03-01T12:00:00Z");
    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry();
        registry.register(new ProviderDescriptor(OPENAI, 1, 0.9, new CostModel(0.01, "token", 100, "usd", 1.0)),
                new ScriptedBackendClient(OPENAI));
        registry.register(new ProviderDescriptor(LOCAL, 1, 0.6, null), new ScriptedBackendClient(LOCAL));
    }

    @Test
    void freeTierAppliesPerOperation() {
        CostTracker tracker = new CostTracker(registry, clock, false);

        assertEquals(0.5, tracker.recordUsage(OPENAI, 150), 1e-9);
        assertEquals(0.0, tracker.recordUsage(OPENAI, 50), 1e-9);

        UsageMetrics usage = tracker.usage(OPENAI).orElseThrow();
        assertEquals(200, usage.totalUnits());
        assertEquals(2, usage.operationCount());
        assertEquals(0.5, usage.totalCost(), 1e-9);
        assertEquals(0.0025, usage.averageCostPerUnit(), 1e-9);
        assertEquals(Instant.parse("2025-03-01T12:00:00Z"), usage.lastUsage());
    }

    @Test
    void freeProviderCostsNothing() {
        CostTracker tracker = new CostTracker(registry, clock, false);

        assertEquals(0.0, tracker.recordUsage(LOCAL, 10_000));
        assertEquals(1.0, tracker.efficiencyScore(LOCAL));
        assertTrue(tracker.usage(OPENAI).isEmpty());
        assertEquals(Set.of(LOCAL), tracker.allUsage().keySet());
    }

    @Test
    void enforcedBudgetIsExceededUntilPeriodReset() {
        CostTracker tracker = new CostTracker(registry, clock, true);
        tracker.recordUsage(OPENAI, 150);
        assertTrue(tracker.withinBudget(OPENAI));

        tracker.recordUsage(OPENAI, 200);
        assertFalse(tracker.withinBudget(OPENAI));

        tracker.resetPeriod();

        assertTrue(tracker.withinBudget(OPENAI));
        assertEquals(0.0, tracker.currentPeriodCost(), 1e-9);
        assertEquals(1.5, tracker.totalCost(), 1e-9);
        assertEquals(350, tracker.usage(OPENAI).orElseThrow().totalUnits());
    }

    @Test
    void budgetsAreIgnoredWhenNotEnforced() {
        CostTracker tracker = new CostTracker(registry, clock, false);
        tracker.recordUsage(OPENAI, 10_000);

        assertTrue(tracker.withinBudget(OPENAI));
        assertFalse(tracker.enforcesBudgets());
    }

    @Test
    void budgetOverrideReplacesDeclaredBudget() {
        CostTracker tracker = new CostTracker(registry, clock, true);
        tracker.setBudget(LOCAL, 0.0);
        tracker.setBudget(OPENAI, 5.0);
        tracker.recordUsage(OPENAI, 200);

        assertEquals(5.0, tracker.budget(OPENAI).orElseThrow());
        assertTrue(tracker.withinBudget(OPENAI));
        assertTrue(tracker.withinBudget(LOCAL));
    }

    @Test
    void invalidInputsAreRejected() {
        CostTracker tracker = new CostTracker(registry, clock, true);
        ProviderId unknown = ProviderId.of(Capability.VECTOR_STORE, "nope");

        assertThrows(IllegalArgumentException.class, () -> tracker.recordUsage(OPENAI, -1));
        assertThrows(IllegalArgumentException.class, () -> tracker.setBudget(OPENAI, -0.5));
        assertThrows(IllegalArgumentException.class, () -> tracker.setBudget(unknown, 1.0));
        assertThrows(IllegalArgumentException.class, () -> tracker.recordUsage(unknown, 1));
        assertTrue(tracker.budget(unknown).isEmpty());
    }
}
