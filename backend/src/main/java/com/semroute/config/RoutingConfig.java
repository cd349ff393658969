/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.config;

import com.semroute.application.ProviderRegistry;
import com.semroute.application.circuit.CircuitBreaker;
import com.semroute.application.cost.CostTracker;
import com.semroute.application.health.HealthMonitor;
import com.semroute.application.routing.FailoverCoordinator;
import com.semroute.application.routing.ProviderRouter;
import com.semroute.application.routing.RoutingObserver;
import com.semroute.application.state.ProviderStateStore;
import com.semroute.domain.model.ProviderDescriptor;
import com.semroute.infrastructure.backend.BackendClientFactory;
import com.semroute.infrastructure.metrics.RoutingMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;

/**
 * Wires the routing engine components that need a slice of {@link RoutingProperties} or
 * startup work. Observers, the state store and the health indicator are picked up by
 * component scanning.
 */
@Configuration
public class RoutingConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Scheduler routingScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    public ProviderRegistry providerRegistry(
            RoutingProperties properties,
            BackendClientFactory clientFactory,
            ProviderStateStore store,
            RoutingMetrics metrics,
            Clock clock
    ) {
        ProviderRegistry registry = new ProviderRegistry();
        for (RoutingProperties.Provider provider : properties.providers()) {
            ProviderDescriptor descriptor = provider.toDescriptor();
            registry.register(descriptor, clientFactory.create(descriptor.id(), provider.client()));
            metrics.bindProvider(descriptor.id(), store, clock);
        }
        return registry;
    }

    @Bean
    public CircuitBreaker circuitBreaker(
            ProviderStateStore store,
            RoutingProperties properties,
            Clock clock,
            ApplicationEventPublisher events
    ) {
        return new CircuitBreaker(store, properties.circuit(), clock, events);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public HealthMonitor healthMonitor(
            ProviderRegistry registry,
            ProviderStateStore store,
            RoutingProperties properties,
            Clock clock,
            ApplicationEventPublisher events,
            Scheduler routingScheduler
    ) {
        return new HealthMonitor(registry, store, properties.health(), clock, events, routingScheduler);
    }

    @Bean
    public CostTracker costTracker(ProviderRegistry registry, Clock clock, RoutingProperties properties) {
        return new CostTracker(registry, clock, properties.costs().enforceBudgets());
    }

    @Bean
    public ProviderRouter providerRouter(
            ProviderRegistry registry,
            ProviderStateStore store,
            CostTracker costTracker,
            RoutingProperties properties
    ) {
        return new ProviderRouter(registry, store, costTracker, properties.scoring());
    }

    @Bean
    public FailoverCoordinator failoverCoordinator(
            ProviderRegistry registry,
            ProviderRouter router,
            ProviderStateStore store,
            CircuitBreaker circuitBreaker,
            HealthMonitor healthMonitor,
            CostTracker costTracker,
            RoutingProperties properties,
            List<RoutingObserver> observers,
            Scheduler routingScheduler
    ) {
        return new FailoverCoordinator(registry, router, store, circuitBreaker, healthMonitor, costTracker,
                properties.failover(), observers, routingScheduler);
    }
}
