/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.api.admin;

import com.semroute.api.ApiException;
import com.semroute.application.ProviderRegistry;
import com.semroute.application.circuit.CircuitBreaker;
import com.semroute.application.cost.CostTracker;
import com.semroute.application.cost.UsageMetrics;
import com.semroute.application.health.HealthMonitor;
import com.semroute.application.routing.ProviderRouter;
import com.semroute.application.routing.RankedCandidate;
import com.semroute.application.state.ProviderStateStore;
import com.semroute.domain.model.Capability;
import com.semroute.domain.model.CircuitSnapshot;
import com.semroute.domain.model.HealthRecord;
import com.semroute.domain.model.ProviderDescriptor;
import com.semroute.domain.model.ProviderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/routing")
public class AdminRoutingController {
    private static final Logger log = LoggerFactory.getLogger(AdminRoutingController.class);

    private final ProviderRegistry registry;
    private final ProviderStateStore store;
    private final HealthMonitor healthMonitor;
    private final CircuitBreaker circuitBreaker;
    private final ProviderRouter router;
    private final CostTracker costTracker;

    public AdminRoutingController(
            ProviderRegistry registry,
            ProviderStateStore store,
            HealthMonitor healthMonitor,
            CircuitBreaker circuitBreaker,
            ProviderRouter router,
            CostTracker costTracker
    ) {
        this.registry = registry;
        this.store = store;
        this.healthMonitor = healthMonitor;
        this.circuitBreaker = circuitBreaker;
        this.router = router;
        this.costTracker = costTracker;
    }

    @GetMapping("/health")
    public List<ProviderStatusView> health() {
        return registry.all().stream()
                .sorted(Comparator.comparing(ProviderDescriptor::capability).thenComparing(ProviderDescriptor::name))
                .map(this::view)
                .toList();
    }

    /** Dry run: what the router would pick right now, with score breakdowns. */
    @GetMapping("/ranking/{capability}")
    public List<RankedCandidate> ranking(@PathVariable("capability") String capability) {
        Capability cap = Capability.fromPath(capability);
        registry.require(cap);
        return router.rank(cap, store.loadSnapshot());
    }

    @PostMapping("/providers/{capability}/{name}/probe")
    public Mono<HealthRecord> probe(@PathVariable("capability") String capability, @PathVariable("name") String name) {
        ProviderId id = resolve(capability, name);
        log.info("Manual probe requested provider={}", id);
        return healthMonitor.probeNow(id);
    }

    @PostMapping("/providers/{capability}/{name}/circuit/reset")
    public CircuitSnapshot resetCircuit(@PathVariable("capability") String capability, @PathVariable("name") String name) {
        ProviderId id = resolve(capability, name);
        circuitBreaker.reset(id);
        return circuitBreaker.snapshot(id);
    }

    @PostMapping("/costs/reset-period")
    public Map<String, Object> resetCostPeriod() {
        double spent = costTracker.currentPeriodCost();
        costTracker.resetPeriod();
        return Map.of("previousPeriodCost", spent, "totalCost", costTracker.totalCost());
    }

    private ProviderStatusView view(ProviderDescriptor d) {
        ProviderId id = d.id();
        return new ProviderStatusView(
                d.capability().pathName(),
                d.name(),
                d,
                store.health(id),
                store.circuit(id),
                circuitBreaker.effectiveState(id),
                store.load(id).get(),
                costTracker.usage(id).orElse(UsageMetrics.empty()),
                costTracker.withinBudget(id)
        );
    }

    private ProviderId resolve(String capability, String name) {
        ProviderId id = ProviderId.of(Capability.fromPath(capability), name);
        if (registry.find(id).isEmpty()) {
            throw new ApiException(HttpStatus.NOT_FOUND, "Provider not found: " + id);
        }
        return id;
    }
}
