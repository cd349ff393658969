/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.config;

import com.semroute.application.routing.RoutingWeights;
import com.semroute.domain.model.Capability;
import com.semroute.domain.model.CostModel;
import com.semroute.domain.model.ProviderDescriptor;
import com.semroute.domain.model.ProviderId;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Everything the routing engine can be tuned with, bound from {@code routing.*}.
 * Missing values fall back to the {@code DEFAULT_*} constants; invalid ones fail startup.
 */
@ConfigurationProperties(prefix = "routing")
public record RoutingProperties(
        Health health,
        Circuit circuit,
        Scoring scoring,
        Failover failover,
        Costs costs,
        List<Provider> providers
) {
    public RoutingProperties {
        health = health == null ? Health.defaults() : health;
        circuit = circuit == null ? Circuit.defaults() : circuit;
        scoring = scoring == null ? Scoring.defaults() : scoring;
        failover = failover == null ? Failover.defaults() : failover;
        costs = costs == null ? Costs.defaults() : costs;
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    public static RoutingProperties defaults() {
        return new RoutingProperties(null, null, null, null, null, null);
    }

    /**
     * @param probeInterval       base period between two probes of the same provider
     * @param probeTimeout        probe deadline, strictly shorter than the interval
     * @param probeJitter         fraction of the interval randomly added or removed per cycle
     * @param failThreshold       consecutive failures before DEGRADED/UNKNOWN becomes UNHEALTHY
     * @param successThreshold    consecutive successes before a provider becomes HEALTHY
     * @param latencyEwmaAlpha    weight of the newest latency sample
     * @param stalenessMultiplier observations older than this many intervals demote the status
     * @param watchdogInterval    period of the staleness check
     */
    public record Health(
            Duration probeInterval,
            Duration probeTimeout,
            Double probeJitter,
            Integer failThreshold,
            Integer successThreshold,
            Double latencyEwmaAlpha,
            Integer stalenessMultiplier,
            Duration watchdogInterval
    ) {
        public static final Duration DEFAULT_PROBE_INTERVAL = Duration.ofSeconds(10);
        public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(5);
        public static final double DEFAULT_PROBE_JITTER = 0.2;
        public static final int DEFAULT_FAIL_THRESHOLD = 3;
        public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
        public static final double DEFAULT_LATENCY_EWMA_ALPHA = 0.3;
        public static final int DEFAULT_STALENESS_MULTIPLIER = 3;
        public static final Duration DEFAULT_WATCHDOG_INTERVAL = Duration.ofSeconds(5);

        public Health {
            probeInterval = probeInterval == null ? DEFAULT_PROBE_INTERVAL : probeInterval;
            probeTimeout = probeTimeout == null ? DEFAULT_PROBE_TIMEOUT : probeTimeout;
            probeJitter = probeJitter == null ? DEFAULT_PROBE_JITTER : probeJitter;
            failThreshold = failThreshold == null ? DEFAULT_FAIL_THRESHOLD : failThreshold;
            successThreshold = successThreshold == null ? DEFAULT_SUCCESS_THRESHOLD : successThreshold;
            latencyEwmaAlpha = latencyEwmaAlpha == null ? DEFAULT_LATENCY_EWMA_ALPHA : latencyEwmaAlpha;
            stalenessMultiplier = stalenessMultiplier == null ? DEFAULT_STALENESS_MULTIPLIER : stalenessMultiplier;
            watchdogInterval = watchdogInterval == null ? DEFAULT_WATCHDOG_INTERVAL : watchdogInterval;

            requirePositive("routing.health.probe-interval", probeInterval);
            requirePositive("routing.health.probe-timeout", probeTimeout);
            requirePositive("routing.health.watchdog-interval", watchdogInterval);
            if (probeTimeout.compareTo(probeInterval) >= 0) {
                throw new IllegalArgumentException("routing.health.probe-timeout (" + probeTimeout
                        + ") must be shorter than probe-interval (" + probeInterval + ")");
            }
            if (probeJitter < 0 || probeJitter >= 1) {
                throw new IllegalArgumentException("routing.health.probe-jitter must be within [0,1)");
            }
            if (failThreshold < 1 || successThreshold < 1 || stalenessMultiplier < 1) {
                throw new IllegalArgumentException("routing.health thresholds and staleness-multiplier must be >= 1");
            }
            if (!(latencyEwmaAlpha > 0 && latencyEwmaAlpha <= 1)) {
                throw new IllegalArgumentException("routing.health.latency-ewma-alpha must be within (0,1]");
            }
        }

        public static Health defaults() {
            return new Health(null, null, null, null, null, null, null, null);
        }

        public Duration stalenessThreshold() {
            return probeInterval.multipliedBy(stalenessMultiplier);
        }
    }

    /**
     * @param openThreshold consecutive failures that open a closed circuit
     * @param baseCooldown  first open period; doubled after every failed half-open probe
     * @param maxCooldown   upper bound of the open period
     */
    public record Circuit(Integer openThreshold, Duration baseCooldown, Duration maxCooldown) {
        public static final int DEFAULT_OPEN_THRESHOLD = 5;
        public static final Duration DEFAULT_BASE_COOLDOWN = Duration.ofSeconds(30);
        public static final Duration DEFAULT_MAX_COOLDOWN = Duration.ofMinutes(5);

        public Circuit {
            openThreshold = openThreshold == null ? DEFAULT_OPEN_THRESHOLD : openThreshold;
            baseCooldown = baseCooldown == null ? DEFAULT_BASE_COOLDOWN : baseCooldown;
            maxCooldown = maxCooldown == null ? DEFAULT_MAX_COOLDOWN : maxCooldown;
            if (openThreshold < 1) {
                throw new IllegalArgumentException("routing.circuit.open-threshold must be >= 1");
            }
            requirePositive("routing.circuit.base-cooldown", baseCooldown);
            if (maxCooldown.compareTo(baseCooldown) < 0) {
                throw new IllegalArgumentException("routing.circuit.max-cooldown must be >= base-cooldown");
            }
        }

        public static Circuit defaults() {
            return new Circuit(null, null, null);
        }
    }

    /**
     * Status penalties are subtracted from the declared quality before weighting.
     * UNKNOWN must not be penalised more than DEGRADED, nor DEGRADED more than UNHEALTHY.
     */
    public record Scoring(
            RoutingWeights weights,
            Double unknownQualityPenalty,
            Double degradedQualityPenalty,
            Double unhealthyQualityPenalty
    ) {
        public static final double DEFAULT_UNKNOWN_QUALITY_PENALTY = 0.1;
        public static final double DEFAULT_DEGRADED_QUALITY_PENALTY = 0.25;
        public static final double DEFAULT_UNHEALTHY_QUALITY_PENALTY = 0.5;

        public Scoring {
            weights = weights == null ? RoutingWeights.defaults() : weights;
            unknownQualityPenalty = unknownQualityPenalty == null ? DEFAULT_UNKNOWN_QUALITY_PENALTY : unknownQualityPenalty;
            degradedQualityPenalty = degradedQualityPenalty == null ? DEFAULT_DEGRADED_QUALITY_PENALTY : degradedQualityPenalty;
            unhealthyQualityPenalty = unhealthyQualityPenalty == null ? DEFAULT_UNHEALTHY_QUALITY_PENALTY : unhealthyQualityPenalty;
            if (unknownQualityPenalty < 0
                    || unknownQualityPenalty > degradedQualityPenalty
                    || degradedQualityPenalty > unhealthyQualityPenalty
                    || unhealthyQualityPenalty > 1) {
                throw new IllegalArgumentException(
                        "routing.scoring penalties must satisfy 0 <= unknown <= degraded <= unhealthy <= 1");
            }
        }

        public static Scoring defaults() {
            return new Scoring(null, null, null, null);
        }
    }

    /**
     * @param maxAttempts       dispatched attempts per request; circuit-rejected skips do not count
     * @param perAttemptTimeout upper bound of a single backend call
     * @param requestDeadline   default global deadline when the caller gives none
     * @param minAttemptBudget  the walk stops when less than this is left of the deadline
     */
    public record Failover(
            Integer maxAttempts,
            Duration perAttemptTimeout,
            Duration requestDeadline,
            Duration minAttemptBudget
    ) {
        public static final int DEFAULT_MAX_ATTEMPTS = 3;
        public static final Duration DEFAULT_PER_ATTEMPT_TIMEOUT = Duration.ofSeconds(5);
        public static final Duration DEFAULT_REQUEST_DEADLINE = Duration.ofSeconds(15);
        public static final Duration DEFAULT_MIN_ATTEMPT_BUDGET = Duration.ofMillis(50);

        public Failover {
            maxAttempts = maxAttempts == null ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
            perAttemptTimeout = perAttemptTimeout == null ? DEFAULT_PER_ATTEMPT_TIMEOUT : perAttemptTimeout;
            requestDeadline = requestDeadline == null ? DEFAULT_REQUEST_DEADLINE : requestDeadline;
            minAttemptBudget = minAttemptBudget == null ? DEFAULT_MIN_ATTEMPT_BUDGET : minAttemptBudget;
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("routing.failover.max-attempts must be >= 1");
            }
            requirePositive("routing.failover.per-attempt-timeout", perAttemptTimeout);
            requirePositive("routing.failover.request-deadline", requestDeadline);
            if (minAttemptBudget.isNegative()) {
                throw new IllegalArgumentException("routing.failover.min-attempt-budget must be >= 0");
            }
        }

        public static Failover defaults() {
            return new Failover(null, null, null, null);
        }
    }

    public record Costs(Boolean enforceBudgets) {
        public Costs {
            enforceBudgets = enforceBudgets != null && enforceBudgets;
        }

        public static Costs defaults() {
            return new Costs(null);
        }
    }

    public record Provider(
            Capability capability,
            String name,
            Double weight,
            Double quality,
            Cost cost,
            Client client
    ) {
        public static final double DEFAULT_WEIGHT = 1.0;
        public static final double DEFAULT_QUALITY = 0.5;

        public Provider {
            if (capability == null) {
                throw new IllegalArgumentException("routing.providers[].capability is required");
            }
            weight = weight == null ? DEFAULT_WEIGHT : weight;
            quality = quality == null ? DEFAULT_QUALITY : quality;
            client = client == null ? Client.nullClient() : client;
        }

        public ProviderDescriptor toDescriptor() {
            CostModel model = cost == null ? CostModel.free() : cost.toModel();
            return new ProviderDescriptor(ProviderId.of(capability, name), weight, quality, model);
        }
    }

    public record Cost(Double perUnit, String unit, Long freeTierUnits, String currency, Double budget) {
        public CostModel toModel() {
            return new CostModel(
                    perUnit == null ? 0 : perUnit,
                    unit,
                    freeTierUnits == null ? 0 : freeTierUnits,
                    currency,
                    budget
            );
        }
    }

    /**
     * @param connectTimeout TCP connect timeout; read timeouts are driven by the failover deadline
     */
    public record Client(
            ClientType type,
            String baseUrl,
            String callPath,
            String probePath,
            Duration connectTimeout
    ) {
        public static final String DEFAULT_CALL_PATH = "/";
        public static final String DEFAULT_PROBE_PATH = "/health";
        public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);

        public Client {
            type = type == null ? ClientType.NULL : type;
            callPath = callPath == null || callPath.isBlank() ? DEFAULT_CALL_PATH : callPath;
            probePath = probePath == null || probePath.isBlank() ? DEFAULT_PROBE_PATH : probePath;
            connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
            if (type == ClientType.HTTP && (baseUrl == null || baseUrl.isBlank())) {
                throw new IllegalArgumentException("routing.providers[].client.base-url is required for HTTP clients");
            }
        }

        public static Client nullClient() {
            return new Client(ClientType.NULL, null, null, null, null);
        }
    }

    public enum ClientType {
        HTTP,
        NULL
    }

    private static void requirePositive(String key, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(key + " must be > 0");
        }
    }
}
