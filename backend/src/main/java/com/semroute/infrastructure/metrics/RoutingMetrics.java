/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.infrastructure.metrics;

import com.semroute.application.events.CircuitTransitionEvent;
import com.semroute.application.events.HealthStatusChangedEvent;
import com.semroute.application.state.ProviderStateStore;
import com.semroute.domain.model.CircuitState;
import com.semroute.domain.model.HealthStatus;
import com.semroute.domain.model.ProviderId;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Micrometer instrumentation of the routing engine.
 *
 * <p>Counters and timers are tagged with {@code capability} and {@code provider}. Gauges read the
 * state store lazily, so they always show the current value without any push.
 */
@Component
public class RoutingMetrics {
    static final String PREFIX = "semroute";

    private final MeterRegistry registry;

    public RoutingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSelection(ProviderId provider) {
        Counter.builder(PREFIX + ".routing.selections")
                .description("Requests served by each provider")
                .tag("capability", capability(provider))
                .tag("provider", provider.name())
                .register(registry)
                .increment();
    }

    public void recordRequest(String capability, String outcome, Duration elapsed) {
        Timer.builder(PREFIX + ".routing.requests")
                .description("End-to-end routed requests, failover included")
                .tag("capability", capability)
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsed);
    }

    public void recordAttempt(ProviderId provider, String outcome, long latencyMillis) {
        Timer.builder(PREFIX + ".provider.calls")
                .description("Backend calls by outcome")
                .tag("capability", capability(provider))
                .tag("provider", provider.name())
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(latencyMillis));
    }

    public void recordError(ProviderId provider, String errorType) {
        Counter.builder(PREFIX + ".provider.errors")
                .description("Backend call failures by error type")
                .tag("capability", capability(provider))
                .tag("provider", provider.name())
                .tag("type", errorType)
                .register(registry)
                .increment();
    }

    public void recordCost(ProviderId provider, double cost) {
        if (cost <= 0) return;
        DistributionSummary.builder(PREFIX + ".provider.cost")
                .description("Cost of successful calls in the provider's currency")
                .tag("capability", capability(provider))
                .tag("provider", provider.name())
                .register(registry)
                .record(cost);
    }

    /** Gauges for one provider: health status, effective circuit state and in-flight calls. */
    public void bindProvider(ProviderId provider, ProviderStateStore store, Clock clock) {
        Gauge.builder(PREFIX + ".provider.health", store, s -> healthValue(s.health(provider).status()))
                .description("3=healthy 2=degraded 1=unhealthy 0=unknown")
                .tag("capability", capability(provider))
                .tag("provider", provider.name())
                .strongReference(true)
                .register(registry);
        Gauge.builder(PREFIX + ".provider.circuit", store, s -> circuitValue(s.circuit(provider).effectiveState(clock.instant())))
                .description("0=closed 1=half-open 2=open")
                .tag("capability", capability(provider))
                .tag("provider", provider.name())
                .strongReference(true)
                .register(registry);
        Gauge.builder(PREFIX + ".provider.in_flight", store, s -> s.load(provider).get())
                .description("Calls currently dispatched to the provider")
                .tag("capability", capability(provider))
                .tag("provider", provider.name())
                .strongReference(true)
                .register(registry);
    }

    @EventListener
    public void onCircuitTransition(CircuitTransitionEvent event) {
        Counter.builder(PREFIX + ".circuit.transitions")
                .description("Circuit breaker state changes")
                .tag("capability", capability(event.provider()))
                .tag("provider", event.provider().name())
                .tag("to", event.to().name())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onHealthStatusChanged(HealthStatusChangedEvent event) {
        Counter.builder(PREFIX + ".health.transitions")
                .description("Provider health status changes")
                .tag("capability", capability(event.provider()))
                .tag("provider", event.provider().name())
                .tag("to", event.to().name())
                .register(registry)
                .increment();
    }

    static double healthValue(HealthStatus status) {
        return switch (status) {
            case HEALTHY -> 3;
            case DEGRADED -> 2;
            case UNHEALTHY -> 1;
            case UNKNOWN -> 0;
        };
    }

    static double circuitValue(CircuitState state) {
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }

    private static String capability(ProviderId provider) {
        return provider.capability().name().toLowerCase();
    }
}
