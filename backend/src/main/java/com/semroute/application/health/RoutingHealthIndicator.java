/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.health;

import com.semroute.application.ProviderRegistry;
import com.semroute.application.circuit.CircuitBreaker;
import com.semroute.domain.model.Capability;
import com.semroute.domain.model.CircuitState;
import com.semroute.domain.model.HealthStatus;
import com.semroute.domain.model.ProviderDescriptor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated view for {@code /actuator/health}: a capability is UP while at least one of its
 * providers is HEALTHY and not cut off by its circuit, DEGRADED while some provider is still
 * eligible, and DOWN when none is. The whole service takes the worst capability status.
 */
@Component
public class RoutingHealthIndicator implements HealthIndicator {
    static final Status DEGRADED = new Status("DEGRADED");

    private final ProviderRegistry registry;
    private final HealthMonitor healthMonitor;
    private final CircuitBreaker circuitBreaker;

    public RoutingHealthIndicator(ProviderRegistry registry, HealthMonitor healthMonitor, CircuitBreaker circuitBreaker) {
        this.registry = registry;
        this.healthMonitor = healthMonitor;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        Status overall = Status.UP;
        for (Capability capability : registry.capabilities()) {
            List<ProviderDescriptor> providers = registry.list(capability);
            long healthy = 0;
            long eligible = 0;
            Map<String, Object> perProvider = new LinkedHashMap<>();
            for (ProviderDescriptor d : providers) {
                HealthStatus status = healthMonitor.health(d.id()).status();
                CircuitState circuit = circuitBreaker.effectiveState(d.id());
                perProvider.put(d.name(), Map.of("health", status.name(), "circuit", circuit.name()));
                if (circuit == CircuitState.OPEN) continue;
                eligible++;
                if (status == HealthStatus.HEALTHY) healthy++;
            }
            Status capabilityStatus = healthy > 0 ? Status.UP : eligible > 0 ? DEGRADED : Status.DOWN;
            details.put(capability.name(), Map.of("status", capabilityStatus.getCode(), "providers", perProvider));
            overall = worse(overall, capabilityStatus);
        }
        details.put("monitorRunning", healthMonitor.isRunning());
        return Health.status(overall).withDetails(details).build();
    }

    private static Status worse(Status a, Status b) {
        return rank(b) > rank(a) ? b : a;
    }

    private static int rank(Status s) {
        if (Status.DOWN.equals(s)) return 2;
        if (DEGRADED.equals(s)) return 1;
        return 0;
    }
}
