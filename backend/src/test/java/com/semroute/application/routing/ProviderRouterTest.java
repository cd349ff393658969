/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

import com.semroute.application.ProviderRegistry;
import com.semroute.application.cost.CostTracker;
import com.semroute.application.state.LoadSnapshot;
import com.semroute.config.RoutingProperties;
import com.semroute.domain.model.Capability;
import com.semroute.domain.model.CircuitState;
import com.semroute.domain.model.CostModel;
import com.semroute.domain.model.HealthStatus;
import com.semroute.domain.model.ProviderDescriptor;
import com.semroute.domain.model.ProviderId;
import com.semroute.support.MutableClock;
import com.semroute.support.ScriptedBackendClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderRouterTest {
    private static final ProviderId A = ProviderId.of(Capability.EMBEDDING, "a");
    private static final ProviderId B = ProviderId.of(Capability.EMBEDDING, "b");
    private static final ProviderId C = ProviderId.of(Capability.EMBEDDING, "c");

    private final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
    private final Map<ProviderId, ProviderSnapshot> snapshots = new HashMap<>();
    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry();
    }

    @Test
    void openCircuitIsFilteredAndQualityBeatsSmallLatencyGap() {
        register(A, 0.9);
        register(B, 0.7);
        register(C, 0.9);
        snapshots.put(A, snapshot(A, CircuitState.CLOSED, HealthStatus.HEALTHY, 50));
        snapshots.put(B, snapshot(B, CircuitState.CLOSED, HealthStatus.HEALTHY, 10));
        snapshots.put(C, snapshot(C, CircuitState.OPEN, HealthStatus.HEALTHY, 5));

        List<RankedCandidate> ranked = router(RoutingProperties.Scoring.defaults()).rank(Capability.EMBEDDING, LoadSnapshot.empty());

        assertEquals(List.of(A, B), ranked.stream().map(RankedCandidate::provider).toList());
        double expectedA = 0.6 * 0.9 + 0.3 / (1 + 0.05) + 0.1;
        assertEquals(expectedA, ranked.get(0).score(), 1e-9);
    }

    @Test
    void halfOpenCircuitStaysEligible() {
        register(A, 0.9);
        snapshots.put(A, snapshot(A, CircuitState.HALF_OPEN, HealthStatus.DEGRADED, 50));

        List<RankedCandidate> ranked = router(RoutingProperties.Scoring.defaults()).rank(Capability.EMBEDDING, LoadSnapshot.empty());

        assertEquals(1, ranked.size());
        assertEquals(CircuitState.HALF_OPEN, ranked.get(0).breakdown().circuitState());
    }

    @Test
    void rankingIsDeterministicForIdenticalInputs() {
        register(A, 0.8);
        register(B, 0.6);
        register(C, 0.7);
        snapshots.put(A, snapshot(A, CircuitState.CLOSED, HealthStatus.HEALTHY, 120));
        snapshots.put(B, snapshot(B, CircuitState.CLOSED, HealthStatus.DEGRADED, 20));
        snapshots.put(C, snapshot(C, CircuitState.CLOSED, HealthStatus.UNKNOWN, 0));
        ProviderRouter router = router(RoutingProperties.Scoring.defaults());
        LoadSnapshot load = new LoadSnapshot(Map.of(A, 2, B, 0, C, 1));

        List<RankedCandidate> first = router.rank(Capability.EMBEDDING, load);
        List<RankedCandidate> second = router.rank(Capability.EMBEDDING, load);

        assertEquals(first, second);
    }

    @Test
    void tiesAreBrokenByNameAscending() {
        ProviderId zeta = ProviderId.of(Capability.EMBEDDING, "zeta");
        ProviderId alpha = ProviderId.of(Capability.EMBEDDING, "alpha");
        register(zeta, 0.5);
        register(alpha, 0.5);
        snapshots.put(zeta, snapshot(zeta, CircuitState.CLOSED, HealthStatus.HEALTHY, 30));
        snapshots.put(alpha, snapshot(alpha, CircuitState.CLOSED, HealthStatus.HEALTHY, 30));

        List<RankedCandidate> ranked = router(RoutingProperties.Scoring.defaults()).rank(Capability.EMBEDDING, LoadSnapshot.empty());

        assertEquals(List.of("alpha", "zeta"), ranked.stream().map(RankedCandidate::name).toList());
    }

    @Test
    void unknownIsPenalisedLessThanDegradedLessThanUnhealthy() {
        ProviderId unknown = ProviderId.of(Capability.EMBEDDING, "u");
        ProviderId degraded = ProviderId.of(Capability.EMBEDDING, "d");
        ProviderId unhealthy = ProviderId.of(Capability.EMBEDDING, "x");
        ProviderId healthy = ProviderId.of(Capability.EMBEDDING, "h");
        for (ProviderId id : List.of(unknown, degraded, unhealthy, healthy)) {
            register(id, 0.8);
        }
        snapshots.put(unknown, snapshot(unknown, CircuitState.CLOSED, HealthStatus.UNKNOWN, 40));
        snapshots.put(degraded, snapshot(degraded, CircuitState.CLOSED, HealthStatus.DEGRADED, 40));
        snapshots.put(unhealthy, snapshot(unhealthy, CircuitState.CLOSED, HealthStatus.UNHEALTHY, 40));
        snapshots.put(healthy, snapshot(healthy, CircuitState.CLOSED, HealthStatus.HEALTHY, 40));

        List<RankedCandidate> ranked = router(RoutingProperties.Scoring.defaults()).rank(Capability.EMBEDDING, LoadSnapshot.empty());

        assertEquals(List.of(healthy, unknown, degraded, unhealthy), ranked.stream().map(RankedCandidate::provider).toList());
        assertEquals(0.1, ranked.get(1).breakdown().qualityPenalty(), 1e-12);
    }

    @Test
    void loneColdProviderIsEligible() {
        register(A, 0.9);
        snapshots.put(A, cold(A));

        RankedCandidate only = router(RoutingProperties.Scoring.defaults()).rank(Capability.EMBEDDING, LoadSnapshot.empty()).get(0);

        assertEquals(ProviderRouter.NO_PEER_LATENCY_SCORE, only.breakdown().latencyScore(), 1e-12);
        assertEquals(0.8, only.breakdown().qualityScore(), 1e-12);
    }

    @Test
    void coldUnknownProviderRanksBelowSlowHealthyProviderOfEqualQuality() {
        ProviderId healthy = ProviderId.of(Capability.EMBEDDING, "healthy");
        ProviderId coldOne = ProviderId.of(Capability.EMBEDDING, "cold");
        register(healthy, 0.9);
        register(coldOne, 0.9);
        snapshots.put(healthy, snapshot(healthy, CircuitState.CLOSED, HealthStatus.HEALTHY, 300));
        snapshots.put(coldOne, cold(coldOne));

        List<RankedCandidate> ranked = router(RoutingProperties.Scoring.defaults()).rank(Capability.EMBEDDING, LoadSnapshot.empty());

        assertEquals(List.of(healthy, coldOne), ranked.stream().map(RankedCandidate::provider).toList());
        assertEquals(ranked.get(0).breakdown().latencyScore(), ranked.get(1).breakdown().latencyScore(), 1e-12);
    }

    @Test
    void coldProviderTakesWorstObservedLatencyAndStillBeatsDegraded() {
        ProviderId fast = ProviderId.of(Capability.EMBEDDING, "fast");
        ProviderId slow = ProviderId.of(Capability.EMBEDDING, "slow");
        ProviderId coldOne = ProviderId.of(Capability.EMBEDDING, "cold");
        register(fast, 0.8);
        register(slow, 0.8);
        register(coldOne, 0.8);
        snapshots.put(fast, snapshot(fast, CircuitState.CLOSED, HealthStatus.HEALTHY, 20));
        snapshots.put(slow, snapshot(slow, CircuitState.CLOSED, HealthStatus.DEGRADED, 1000));
        snapshots.put(coldOne, cold(coldOne));

        List<RankedCandidate> ranked = router(RoutingProperties.Scoring.defaults()).rank(Capability.EMBEDDING, LoadSnapshot.empty());

        assertEquals(List.of(fast, coldOne, slow), ranked.stream().map(RankedCandidate::provider).toList());
        assertEquals(0.5, ranked.get(1).breakdown().latencyScore(), 1e-12);
    }

    @Test
    void busierProviderLosesOtherwiseEqualComparison() {
        register(A, 0.8);
        register(B, 0.8);
        snapshots.put(A, snapshot(A, CircuitState.CLOSED, HealthStatus.HEALTHY, 40));
        snapshots.put(B, snapshot(B, CircuitState.CLOSED, HealthStatus.HEALTHY, 40));

        List<RankedCandidate> ranked = router(RoutingProperties.Scoring.defaults())
                .rank(Capability.EMBEDDING, new LoadSnapshot(Map.of(A, 4)));

        assertEquals(B, ranked.get(0).provider());
        assertEquals(4, ranked.get(1).breakdown().inFlight());
        assertEquals(0.2, ranked.get(1).breakdown().loadScore(), 1e-12);
    }

    @Test
    void costWeightFavoursCheaperProvider() {
        registry.register(new ProviderDescriptor(A, 1, 0.8, new CostModel(0.9, "request", 0, null, null)), new ScriptedBackendClient(A));
        registry.register(new ProviderDescriptor(B, 1, 0.8, CostModel.free()), new ScriptedBackendClient(B));
        snapshots.put(A, snapshot(A, CircuitState.CLOSED, HealthStatus.HEALTHY, 40));
        snapshots.put(B, snapshot(B, CircuitState.CLOSED, HealthStatus.HEALTHY, 40));
        RoutingProperties.Scoring scoring = new RoutingProperties.Scoring(new RoutingWeights(0.5, 0.2, 0.1, 0.0, 0.2), null, null, null);

        List<RankedCandidate> ranked = router(scoring).rank(Capability.EMBEDDING, LoadSnapshot.empty());

        assertEquals(B, ranked.get(0).provider());
        assertTrue(ranked.get(0).score() > ranked.get(1).score());
    }

    @Test
    void overBudgetProviderIsExcludedWhenBudgetsAreEnforced() {
        registry.register(new ProviderDescriptor(A, 1, 0.9, new CostModel(1.0, "request", 0, null, 2.0)), new ScriptedBackendClient(A));
        register(B, 0.5);
        snapshots.put(A, snapshot(A, CircuitState.CLOSED, HealthStatus.HEALTHY, 40));
        snapshots.put(B, snapshot(B, CircuitState.CLOSED, HealthStatus.HEALTHY, 40));
        CostTracker costs = new CostTracker(registry, clock, true);
        ProviderRouter router = new ProviderRouter(registry, snapshots::get, costs, RoutingProperties.Scoring.defaults());

        costs.recordUsage(A, 3);

        assertEquals(List.of(B), router.rank(Capability.EMBEDDING, LoadSnapshot.empty()).stream().map(RankedCandidate::provider).toList());
    }

    @Test
    void otherCapabilitiesAreIgnored() {
        ProviderId store = ProviderId.of(Capability.VECTOR_STORE, "qdrant");
        register(A, 0.5);
        register(store, 0.9);
        snapshots.put(A, snapshot(A, CircuitState.CLOSED, HealthStatus.HEALTHY, 40));
        snapshots.put(store, snapshot(store, CircuitState.CLOSED, HealthStatus.HEALTHY, 40));

        List<RankedCandidate> ranked = router(RoutingProperties.Scoring.defaults()).rank(Capability.EMBEDDING, LoadSnapshot.empty());

        assertEquals(List.of(A), ranked.stream().map(RankedCandidate::provider).toList());
    }

    private ProviderRouter router(RoutingProperties.Scoring scoring) {
        return new ProviderRouter(registry, snapshots::get, new CostTracker(registry, clock, false), scoring);
    }

    private void register(ProviderId id, double quality) {
        registry.register(new ProviderDescriptor(id, 1, quality, null), new ScriptedBackendClient(id));
    }

    private static ProviderSnapshot snapshot(ProviderId id, CircuitState circuit, HealthStatus status, double latencyMillis) {
        return new ProviderSnapshot(id, circuit, status, latencyMillis, true, 0, null);
    }

    private static ProviderSnapshot cold(ProviderId id) {
        return new ProviderSnapshot(id, CircuitState.CLOSED, HealthStatus.UNKNOWN, 0, false, 0, null);
    }
}
