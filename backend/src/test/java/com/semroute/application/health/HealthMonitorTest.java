/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.health;

import com.semroute.application.ProviderRegistry;
import com.semroute.application.events.HealthStatusChangedEvent;
import com.semroute.application.state.ProviderStateStore;
import com.semroute.config.RoutingProperties;
import com.semroute.domain.model.Capability;
import com.semroute.domain.model.HealthRecord;
import com.semroute.domain.model.HealthStatus;
import com.semroute.domain.model.ProviderDescriptor;
import com.semroute.domain.model.ProviderId;
import com.semroute.infrastructure.backend.BackendErrorType;
import com.semroute.infrastructure.backend.BackendException;
import com.semroute.support.Await;
import com.semroute.support.MutableClock;
import com.semroute.support.ScriptedBackendClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealthMonitorTest {
    private static final ProviderId A = ProviderId.of(Capability.EMBEDDING, "a");
    private static final Duration BLOCK = Duration.ofSeconds(5);

    private MutableClock clock;
    private ProviderRegistry registry;
    private ProviderStateStore store;
    private ScriptedBackendClient client;
    private List<Object> events;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        registry = new ProviderRegistry();
        client = new ScriptedBackendClient(A);
        registry.register(new ProviderDescriptor(A, 1, 0.8, null), client);
        store = new ProviderStateStore(clock);
        events = new CopyOnWriteArrayList<>();
        monitor = monitor(config(Duration.ofSeconds(10), Duration.ofMillis(200)), events::add);
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
    }

    @Test
    void probeSuccessesPromoteAfterSuccessThreshold() {
        HealthRecord first = monitor.probeNow(A).block(BLOCK);
        assertNotNull(first);
        assertEquals(HealthStatus.UNKNOWN, first.status());
        assertEquals(clock.instant(), first.lastProbeAt());
        assertTrue(first.hasLatency());

        HealthRecord second = monitor.probeNow(A).block(BLOCK);
        assertEquals(HealthStatus.HEALTHY, second.status());
        assertEquals(1, events.size());
        HealthStatusChangedEvent event = (HealthStatusChangedEvent) events.get(0);
        assertEquals(HealthStatus.UNKNOWN, event.from());
        assertEquals(HealthStatus.HEALTHY, event.to());
    }

    @Test
    void probeErrorIsRecordedNotPropagated() {
        client.probeWith(() -> Mono.error(new BackendException(A, BackendErrorType.CONNECTION, "connection refused")));

        HealthRecord record = monitor.probeNow(A).block(BLOCK);

        assertEquals(HealthStatus.DEGRADED, record.status());
        assertEquals(1, record.consecutiveFailures());
        assertTrue(record.lastError().contains("CONNECTION"), record.lastError());
        assertFalse(record.hasLatency());
    }

    @Test
    void probeTimeoutCountsAsFailure() {
        client.probeWith(Mono::never);

        HealthRecord record = monitor.probeNow(A).block(BLOCK);

        assertEquals(HealthStatus.DEGRADED, record.status());
        assertTrue(record.lastError().contains("timed out"), record.lastError());
    }

    @Test
    void probeThatThrowsIsCapturedToo() {
        client.probeWith(() -> {
            throw new IllegalStateException("driver bug");
        });

        HealthRecord record = monitor.probeNow(A).block(BLOCK);

        assertEquals(HealthStatus.DEGRADED, record.status());
        assertTrue(record.lastError().contains("driver bug"), record.lastError());
    }

    @Test
    void realCallOutcomesUseTheSameRules() {
        monitor.recordCallOutcome(A, true, Duration.ofMillis(40));
        HealthRecord healthy = monitor.recordCallOutcome(A, true, Duration.ofMillis(60));
        assertEquals(HealthStatus.HEALTHY, healthy.status());
        assertNull(healthy.lastProbeAt());
        assertEquals(clock.instant(), healthy.lastObservedAt());

        HealthRecord degraded = monitor.recordCallOutcome(A, false, Duration.ofMillis(900), "HTTP 503");
        assertEquals(HealthStatus.DEGRADED, degraded.status());
        assertEquals("HTTP 503", degraded.lastError());

        monitor.recordCallOutcome(A, false, Duration.ofMillis(900));
        HealthRecord unhealthy = monitor.recordCallOutcome(A, false, Duration.ofMillis(900));
        assertEquals(HealthStatus.UNHEALTHY, unhealthy.status());
    }

    @Test
    void watchdogDemotesSilentProviders() {
        monitor.recordCallOutcome(A, true, Duration.ofMillis(10));
        monitor.recordCallOutcome(A, true, Duration.ofMillis(10));
        events.clear();

        clock.advance(Duration.ofSeconds(30));
        monitor.checkStaleness();
        assertEquals(HealthStatus.HEALTHY, monitor.health(A).status());

        clock.advance(Duration.ofSeconds(1));
        monitor.checkStaleness();
        assertEquals(HealthStatus.DEGRADED, monitor.health(A).status());
        assertEquals(1, events.size());

        monitor.checkStaleness();
        assertEquals(HealthStatus.DEGRADED, monitor.health(A).status());
    }

    @Test
    void startRunsPeriodicProbesAndStopCancelsThem() throws Exception {
        monitor = monitor(config(Duration.ofMillis(50), Duration.ofMillis(20)), events::add);

        monitor.start();
        assertTrue(monitor.isRunning());
        Await.until(() -> client.probes() >= 3, BLOCK, "three scheduled probes");
        assertEquals(HealthStatus.HEALTHY, monitor.health(A).status());

        monitor.stop();
        assertFalse(monitor.isRunning());
        Thread.sleep(100);
        int afterStop = client.probes();
        Thread.sleep(200);
        assertEquals(afterStop, client.probes());
    }

    @Test
    void crashedProbeTaskIsRespawned() {
        AtomicBoolean thrown = new AtomicBoolean();
        ApplicationEventPublisher flaky = event -> {
            if (thrown.compareAndSet(false, true)) {
                throw new IllegalStateException("listener blew up");
            }
        };
        monitor = monitor(config(Duration.ofMillis(50), Duration.ofMillis(20), 1), flaky);

        monitor.start();
        Await.until(() -> monitor.probeTaskRestarts(A) == 1, BLOCK, "probe task restart");
        int probesAtRestart = client.probes();
        Await.until(() -> client.probes() >= probesAtRestart + 2, BLOCK, "probes after restart");

        assertEquals(1, monitor.probeTaskRestarts(A));
        assertEquals(HealthStatus.HEALTHY, monitor.health(A).status());
    }

    @Test
    void jitterStaysWithinConfiguredBand() {
        HealthMonitor jittered = monitor(new RoutingProperties.Health(
                Duration.ofSeconds(10), Duration.ofSeconds(1), 0.2, 3, 2, 0.3, 3, Duration.ofSeconds(5)), events::add);

        for (int i = 0; i < 200; i++) {
            long millis = jittered.nextDelay().toMillis();
            assertTrue(millis >= 8_000 && millis <= 12_000, "delay " + millis);
        }
    }

    private HealthMonitor monitor(RoutingProperties.Health config, ApplicationEventPublisher publisher) {
        if (monitor != null) {
            monitor.stop();
        }
        return new HealthMonitor(registry, store, config, clock, publisher, Schedulers.parallel());
    }

    private static RoutingProperties.Health config(Duration interval, Duration timeout) {
        return config(interval, timeout, 2);
    }

    private static RoutingProperties.Health config(Duration interval, Duration timeout, int successThreshold) {
        return new RoutingProperties.Health(interval, timeout, 0.0, 3, successThreshold, 0.5, 3, Duration.ofSeconds(10));
    }
}
