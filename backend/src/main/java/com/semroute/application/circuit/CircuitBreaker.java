/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.circuit;

import com.semroute.application.events.CircuitTransitionEvent;
import com.semroute.application.state.ProviderStateStore;
import com.semroute.application.state.StateTransition;
import com.semroute.config.RoutingProperties;
import com.semroute.domain.model.CircuitSnapshot;
import com.semroute.domain.model.CircuitState;
import com.semroute.domain.model.ProviderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-provider CLOSED / OPEN / HALF_OPEN state machine driven by real call outcomes.
 *
 * <p>All transitions are compare-and-set updates on the snapshot held by the
 * {@link ProviderStateStore}. When the cooldown of an open circuit has elapsed the first caller
 * to win the CAS gets a {@link CircuitPermit.Kind#PROBE PROBE} permit; everyone else keeps being
 * rejected until that probe reports back.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final ProviderStateStore store;
    private final RoutingProperties.Circuit config;
    private final Clock clock;
    private final ApplicationEventPublisher events;

    public CircuitBreaker(ProviderStateStore store, RoutingProperties.Circuit config, Clock clock, ApplicationEventPublisher events) {
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.events = events;
    }

    public CircuitPermit tryAcquire(ProviderId provider) {
        Instant now = clock.instant();
        StateTransition<CircuitSnapshot> t = store.updateCircuit(provider, current -> {
            if (current.state() == CircuitState.OPEN && current.cooldownElapsed(now)) {
                return current.halfOpenWithProbe();
            }
            if (current.state() == CircuitState.HALF_OPEN && !current.halfOpenProbeInFlight()) {
                return current.halfOpenWithProbe();
            }
            return current;
        });

        CircuitSnapshot after = t.after();
        if (t.changed()) {
            publish(provider, t, now);
            return CircuitPermit.probe(provider, after.generation());
        }
        if (after.state() == CircuitState.CLOSED) {
            return CircuitPermit.admitted(provider, after.generation());
        }
        return CircuitPermit.rejected(provider, after.generation(), after.retryAt());
    }

    /**
     * Same as {@link #tryAcquire} but rejects with {@link CircuitOpenException}.
     */
    public CircuitPermit acquire(ProviderId provider) {
        CircuitPermit permit = tryAcquire(provider);
        if (!permit.granted()) {
            throw permit.toException();
        }
        return permit;
    }

    public void onSuccess(CircuitPermit permit) {
        if (!permit.granted()) return;
        Instant now = clock.instant();
        StateTransition<CircuitSnapshot> t = store.updateCircuit(permit.provider(), current -> {
            if (current.generation() != permit.generation()) {
                return current;
            }
            if (permit.isProbe() && current.state() == CircuitState.HALF_OPEN) {
                return current.close();
            }
            if (!permit.isProbe() && current.state() == CircuitState.CLOSED && current.failureCount() > 0) {
                return current.withFailureCount(0);
            }
            return current;
        });
        publish(permit.provider(), t, now);
    }

    public void onFailure(CircuitPermit permit) {
        if (!permit.granted()) return;
        Instant now = clock.instant();
        StateTransition<CircuitSnapshot> t = store.updateCircuit(permit.provider(), current -> {
            if (current.generation() != permit.generation()) {
                return current;
            }
            if (permit.isProbe() && current.state() == CircuitState.HALF_OPEN) {
                int opens = current.consecutiveOpens() + 1;
                return current.open(now, opens, cooldownFor(opens));
            }
            if (!permit.isProbe() && current.state() == CircuitState.CLOSED) {
                int failures = current.failureCount() + 1;
                if (failures >= config.openThreshold()) {
                    return current.open(now, current.consecutiveOpens(), cooldownFor(current.consecutiveOpens()));
                }
                return current.withFailureCount(failures);
            }
            return current;
        });
        publish(permit.provider(), t, now);
    }

    /**
     * Gives back an unused half-open slot, e.g. when the caller cancelled before an outcome was
     * known. Not counted as a failure. No-op for other permits.
     */
    public void release(CircuitPermit permit) {
        if (!permit.isProbe()) return;
        store.updateCircuit(permit.provider(), current -> {
            if (current.generation() == permit.generation()
                    && current.state() == CircuitState.HALF_OPEN
                    && current.halfOpenProbeInFlight()) {
                return current.withProbeReleased();
            }
            return current;
        });
        log.debug("Half-open slot released provider={}", permit.provider());
    }

    /** Forces CLOSED and forgets the open history. Outstanding permits become stale. */
    public void reset(ProviderId provider) {
        Instant now = clock.instant();
        StateTransition<CircuitSnapshot> t = store.updateCircuit(provider, CircuitSnapshot::close);
        log.info("Circuit reset provider={} previous={}", provider, t.before().state());
        publish(provider, t, now);
    }

    public CircuitSnapshot snapshot(ProviderId provider) {
        return store.circuit(provider);
    }

    public CircuitState effectiveState(ProviderId provider) {
        return store.circuit(provider).effectiveState(clock.instant());
    }

    /** base x 2^opens, capped at the configured maximum. */
    Duration cooldownFor(int consecutiveOpens) {
        Duration base = config.baseCooldown();
        Duration max = config.maxCooldown();
        if (consecutiveOpens <= 0) return base;
        if (consecutiveOpens >= 62) return max;
        long factor = 1L << consecutiveOpens;
        long baseMillis = base.toMillis();
        if (baseMillis > max.toMillis() / factor) return max;
        Duration scaled = Duration.ofMillis(baseMillis * factor);
        return scaled.compareTo(max) > 0 ? max : scaled;
    }

    private void publish(ProviderId provider, StateTransition<CircuitSnapshot> t, Instant now) {
        CircuitState from = t.before().state();
        CircuitState to = t.after().state();
        if (from == to) return;
        if (to == CircuitState.OPEN) {
            log.warn("Circuit opened provider={} from={} cooldown={} consecutiveOpens={}",
                    provider, from, t.after().cooldown(), t.after().consecutiveOpens());
        } else {
            log.info("Circuit transition provider={} from={} to={}", provider, from, to);
        }
        events.publishEvent(new CircuitTransitionEvent(provider, from, to, t.after().cooldown(), now));
    }
}
