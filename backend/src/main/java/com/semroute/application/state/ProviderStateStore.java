/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.state;

import com.semroute.application.routing.ProviderHealthReader;
import com.semroute.application.routing.ProviderSnapshot;
import com.semroute.domain.model.CircuitSnapshot;
import com.semroute.domain.model.HealthRecord;
import com.semroute.domain.model.ProviderId;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Owner of all mutable per-provider state: health record, circuit snapshot and load counter.
 *
 * <p>Entries are created lazily on first reference. Each value is immutable and swapped with
 * compare-and-set, so readers get a consistent copy without locking and no lock is ever held
 * while a backend call is pending.
 */
@Component
public class ProviderStateStore implements ProviderHealthReader {
    private final Clock clock;
    private final ConcurrentHashMap<ProviderId, ProviderState> states = new ConcurrentHashMap<>();

    public ProviderStateStore(Clock clock) {
        this.clock = clock;
    }

    public HealthRecord health(ProviderId provider) {
        return state(provider).health.get();
    }

    public CircuitSnapshot circuit(ProviderId provider) {
        return state(provider).circuit.get();
    }

    public LoadCounter load(ProviderId provider) {
        return state(provider).load;
    }

    public StateTransition<HealthRecord> updateHealth(ProviderId provider, UnaryOperator<HealthRecord> update) {
        return update(state(provider).health, update);
    }

    public StateTransition<CircuitSnapshot> updateCircuit(ProviderId provider, UnaryOperator<CircuitSnapshot> update) {
        return update(state(provider).circuit, update);
    }

    public LoadSnapshot loadSnapshot() {
        Map<ProviderId, Integer> counts = new HashMap<>();
        states.forEach((id, state) -> counts.put(id, state.load.get()));
        return new LoadSnapshot(counts);
    }

    @Override
    public ProviderSnapshot getSnapshot(ProviderId provider) {
        ProviderState state = state(provider);
        HealthRecord health = state.health.get();
        CircuitSnapshot circuit = state.circuit.get();
        return new ProviderSnapshot(
                provider,
                circuit.effectiveState(clock.instant()),
                health.status(),
                health.latencyEwmaMillis(),
                health.hasLatency(),
                health.consecutiveFailures(),
                health.lastObservedAt()
        );
    }

    private ProviderState state(ProviderId provider) {
        return states.computeIfAbsent(provider, id -> new ProviderState());
    }

    private static <T> StateTransition<T> update(AtomicReference<T> ref, UnaryOperator<T> update) {
        while (true) {
            T before = ref.get();
            T after = update.apply(before);
            if (after == before || ref.compareAndSet(before, after)) {
                return new StateTransition<>(before, after);
            }
        }
    }

    private static final class ProviderState {
        private final AtomicReference<HealthRecord> health = new AtomicReference<>(HealthRecord.unknown());
        private final AtomicReference<CircuitSnapshot> circuit = new AtomicReference<>(CircuitSnapshot.closed());
        private final LoadCounter load = new LoadCounter();
    }
}
