/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.health;

import com.semroute.application.ProviderRegistry;
import com.semroute.application.events.HealthStatusChangedEvent;
import com.semroute.application.state.ProviderStateStore;
import com.semroute.application.state.StateTransition;
import com.semroute.config.RoutingProperties;
import com.semroute.domain.model.HealthRecord;
import com.semroute.domain.model.HealthStatus;
import com.semroute.domain.model.ProviderDescriptor;
import com.semroute.domain.model.ProviderId;
import com.semroute.infrastructure.backend.BackendClient;
import com.semroute.infrastructure.backend.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps every provider's {@link HealthRecord} current.
 *
 * <p>Each registered provider gets its own jittered probe loop so one slow backend never delays
 * the others. Real call outcomes reported by the failover coordinator go through the same
 * update rules. A watchdog demotes providers nobody has heard from for a while.
 */
public class HealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final ProviderRegistry registry;
    private final ProviderStateStore store;
    private final RoutingProperties.Health config;
    private final Clock clock;
    private final ApplicationEventPublisher events;
    private final Scheduler scheduler;

    private final Map<ProviderId, Disposable> probeTasks = new ConcurrentHashMap<>();
    private final Map<ProviderId, AtomicInteger> restarts = new ConcurrentHashMap<>();
    private volatile Disposable watchdog;
    private volatile boolean running;

    public HealthMonitor(
            ProviderRegistry registry,
            ProviderStateStore store,
            RoutingProperties.Health config,
            Clock clock,
            ApplicationEventPublisher events,
            Scheduler scheduler
    ) {
        this.registry = registry;
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.events = events;
        this.scheduler = scheduler;
    }

    public synchronized void start() {
        if (running) return;
        running = true;
        for (ProviderDescriptor descriptor : registry.all()) {
            spawnProbeTask(descriptor.id());
        }
        watchdog = Flux.interval(config.watchdogInterval(), config.watchdogInterval(), scheduler)
                .subscribe(tick -> checkStaleness(), e -> log.error("Staleness watchdog stopped", e));
        log.info("Health monitor started providers={} probeInterval={} probeTimeout={}",
                probeTasks.size(), config.probeInterval(), config.probeTimeout());
    }

    public synchronized void stop() {
        if (!running) return;
        running = false;
        probeTasks.values().forEach(Disposable::dispose);
        probeTasks.clear();
        if (watchdog != null) {
            watchdog.dispose();
            watchdog = null;
        }
        log.info("Health monitor stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public HealthRecord health(ProviderId provider) {
        return store.health(provider);
    }

    /** Number of times the probe loop of this provider had to be re-subscribed after crashing. */
    public int probeTaskRestarts(ProviderId provider) {
        AtomicInteger count = restarts.get(provider);
        return count == null ? 0 : count.get();
    }

    /**
     * Runs one probe now, outside the schedule. Never fails: probe errors end up in the record.
     */
    public Mono<HealthRecord> probeNow(ProviderId provider) {
        return Mono.defer(() -> {
            BackendClient<?, ?> client = registry.client(provider);
            long startNanos = System.nanoTime();
            return Mono.defer(client::probe)
                    .timeout(config.probeTimeout(), scheduler)
                    .then(Mono.fromSupplier(ProbeOutcome::ok))
                    .onErrorResume(e -> Mono.just(ProbeOutcome.failed(describe(e))))
                    .map(outcome -> apply(provider, outcome.success(), elapsedMillis(startNanos), outcome.error(), true));
        });
    }

    /**
     * Applies the outcome of a real call. Same rules as a probe; also refreshes the observation
     * timestamp the staleness watchdog looks at.
     */
    public HealthRecord recordCallOutcome(ProviderId provider, boolean success, Duration latency) {
        return recordCallOutcome(provider, success, latency, success ? null : "call failed");
    }

    public HealthRecord recordCallOutcome(ProviderId provider, boolean success, Duration latency, String error) {
        double millis = latency == null ? 0 : latency.toNanos() / 1_000_000.0;
        return apply(provider, success, millis, error, false);
    }

    /** Demotes providers whose last observation is older than the staleness threshold. */
    public void checkStaleness() {
        Instant now = clock.instant();
        Duration maxAge = config.stalenessThreshold();
        for (ProviderDescriptor descriptor : registry.all()) {
            StateTransition<HealthRecord> t = store.updateHealth(descriptor.id(), r -> r.demoteIfStale(now, maxAge));
            if (t.before().status() != t.after().status()) {
                log.warn("Provider stale provider={} from={} to={} lastObservedAt={}",
                        descriptor.id(), t.before().status(), t.after().status(), t.after().lastObservedAt());
                events.publishEvent(new HealthStatusChangedEvent(
                        descriptor.id(), t.before().status(), t.after().status(), "stale", now));
            }
        }
    }

    /** Probe period with uniform jitter of +/- probeJitter around the configured interval. */
    Duration nextDelay() {
        long base = config.probeInterval().toMillis();
        double factor = 1 + config.probeJitter() * (2 * ThreadLocalRandom.current().nextDouble() - 1);
        return Duration.ofMillis(Math.max(1, Math.round(base * factor)));
    }

    private void spawnProbeTask(ProviderId provider) {
        Disposable task = Mono.defer(() -> Mono.delay(nextDelay(), scheduler))
                .then(Mono.defer(() -> probeNow(provider)))
                .repeat()
                .subscribe(
                        r -> log.debug("Probe done provider={} status={} ewmaMs={}", provider, r.status(), r.latencyEwmaMillis()),
                        e -> onProbeTaskCrashed(provider, e)
                );
        probeTasks.put(provider, task);
    }

    private synchronized void onProbeTaskCrashed(ProviderId provider, Throwable error) {
        log.error("Probe task crashed provider={}", provider, error);
        if (!running) return;
        restarts.computeIfAbsent(provider, id -> new AtomicInteger()).incrementAndGet();
        spawnProbeTask(provider);
    }

    private HealthRecord apply(ProviderId provider, boolean success, double latencyMillis, String error, boolean probe) {
        Instant now = clock.instant();
        StateTransition<HealthRecord> t = store.updateHealth(provider, r -> success
                ? r.recordSuccess(latencyMillis, now, probe, config.successThreshold(), config.latencyEwmaAlpha())
                : r.recordFailure(error, now, probe, config.failThreshold()));

        if (!success && probe) {
            log.debug("Probe failed provider={} failures={} error={}", provider, t.after().consecutiveFailures(), error);
        }
        if (t.before().status() != t.after().status()) {
            if (t.after().status() == HealthStatus.HEALTHY) {
                log.info("Provider health changed provider={} from={} to={}", provider, t.before().status(), t.after().status());
            } else {
                log.warn("Provider health changed provider={} from={} to={} error={}",
                        provider, t.before().status(), t.after().status(), error);
            }
            events.publishEvent(new HealthStatusChangedEvent(
                    provider, t.before().status(), t.after().status(), probe ? "probe" : "call", now));
        }
        return t.after();
    }

    private String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "probe timed out after " + config.probeTimeout().toMillis() + "ms";
        }
        if (e instanceof BackendException be) {
            return be.getType() + ": " + be.getSafeMessage();
        }
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private record ProbeOutcome(boolean success, String error) {
        static ProbeOutcome ok() {
            return new ProbeOutcome(true, null);
        }

        static ProbeOutcome failed(String error) {
            return new ProbeOutcome(false, error);
        }
    }
}
