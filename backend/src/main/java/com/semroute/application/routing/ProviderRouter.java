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
import com.semroute.domain.model.HealthStatus;
import com.semroute.domain.model.ProviderDescriptor;
import com.semroute.domain.model.ProviderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless ranking of the providers of one capability.
 *
 * <p>Providers with an open circuit are dropped; a circuit whose cooldown has elapsed is
 * reported HALF_OPEN by the health reader and stays eligible. Everything else is scored with
 * the configured {@link RoutingWeights} and sorted best first, ties broken by name. The router
 * reads snapshots only: it never mutates state and never calls a backend.
 */
public class ProviderRouter {
    private static final Logger log = LoggerFactory.getLogger(ProviderRouter.class);

    private static final Comparator<RankedCandidate> BEST_FIRST = Comparator
            .comparingDouble(RankedCandidate::score).reversed()
            .thenComparing(RankedCandidate::name);

    // all peers cold: latency cannot separate them
    static final double NO_PEER_LATENCY_SCORE = 1.0;

    private final ProviderRegistry registry;
    private final ProviderHealthReader healthReader;
    private final CostTracker costTracker;
    private final RoutingProperties.Scoring scoring;

    public ProviderRouter(
            ProviderRegistry registry,
            ProviderHealthReader healthReader,
            CostTracker costTracker,
            RoutingProperties.Scoring scoring
    ) {
        this.registry = registry;
        this.healthReader = healthReader;
        this.costTracker = costTracker;
        this.scoring = scoring;
    }

    public List<RankedCandidate> rank(Capability capability, LoadSnapshot load) {
        List<ProviderDescriptor> eligible = new ArrayList<>();
        Map<ProviderId, ProviderSnapshot> snapshots = new HashMap<>();
        for (ProviderDescriptor descriptor : registry.list(capability)) {
            ProviderSnapshot snapshot = healthReader.getSnapshot(descriptor.id());
            if (snapshot.circuitState() == CircuitState.OPEN) {
                continue;
            }
            if (!costTracker.withinBudget(descriptor.id())) {
                log.debug("Provider over budget, skipped provider={}", descriptor.id());
                continue;
            }
            eligible.add(descriptor);
            snapshots.put(descriptor.id(), snapshot);
        }

        double unobservedLatencyScore = unobservedLatencyScore(snapshots.values());
        List<RankedCandidate> ranked = new ArrayList<>(eligible.size());
        for (ProviderDescriptor descriptor : eligible) {
            ScoreBreakdown breakdown = score(
                    descriptor, snapshots.get(descriptor.id()), load.inFlight(descriptor.id()), unobservedLatencyScore);
            ranked.add(new RankedCandidate(descriptor.id(), breakdown.totalScore(), breakdown));
        }
        ranked.sort(BEST_FIRST);
        return List.copyOf(ranked);
    }

    /**
     * Latency score given to a provider without samples: the worst score among its observed
     * peers, so an unmeasured provider never outranks a measured one on latency alone.
     */
    static double unobservedLatencyScore(Collection<ProviderSnapshot> peers) {
        double worst = NO_PEER_LATENCY_SCORE;
        for (ProviderSnapshot peer : peers) {
            if (peer.hasLatency()) {
                worst = Math.min(worst, latencyScore(peer.latencyEwmaMillis()));
            }
        }
        return worst;
    }

    ScoreBreakdown score(ProviderDescriptor descriptor, ProviderSnapshot snapshot, int inFlight, double unobservedLatencyScore) {
        RoutingWeights w = scoring.weights();

        double penalty = penaltyFor(snapshot.healthStatus());
        double quality = clamp01(descriptor.quality() - penalty);
        double latencyScore = snapshot.hasLatency()
                ? latencyScore(snapshot.latencyEwmaMillis())
                : unobservedLatencyScore;
        double loadScore = 1.0 / (1.0 + Math.max(0, inFlight));
        double preference = clamp01(descriptor.weight());
        double costScore = descriptor.cost().efficiencyScore();

        double total = w.quality() * quality
                + w.latency() * latencyScore
                + w.load() * loadScore
                + w.preference() * preference
                + w.cost() * costScore;

        return new ScoreBreakdown(
                total,
                descriptor.quality(),
                penalty,
                quality,
                latencyScore,
                loadScore,
                preference,
                costScore,
                snapshot.healthStatus(),
                snapshot.circuitState(),
                snapshot.latencyEwmaMillis(),
                inFlight
        );
    }

    private static double latencyScore(double ewmaMillis) {
        return 1.0 / (1.0 + ewmaMillis / 1000.0);
    }

    private double penaltyFor(HealthStatus status) {
        return switch (status) {
            case HEALTHY -> 0.0;
            case UNKNOWN -> scoring.unknownQualityPenalty();
            case DEGRADED -> scoring.degradedQualityPenalty();
            case UNHEALTHY -> scoring.unhealthyQualityPenalty();
        };
    }

    private static double clamp01(double v) {
        if (v < 0) return 0;
        if (v > 1) return 1;
        return v;
    }
}
