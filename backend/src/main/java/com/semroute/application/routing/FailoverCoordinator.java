/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

import com.semroute.application.ProviderRegistry;
import com.semroute.application.circuit.CircuitBreaker;
import com.semroute.application.circuit.CircuitPermit;
import com.semroute.application.cost.CostTracker;
import com.semroute.application.health.HealthMonitor;
import com.semroute.application.state.LoadCounter;
import com.semroute.application.state.ProviderStateStore;
import com.semroute.config.RoutingProperties;
import com.semroute.domain.model.Capability;
import com.semroute.domain.model.ProviderDescriptor;
import com.semroute.domain.model.ProviderId;
import com.semroute.infrastructure.backend.BackendClient;
import com.semroute.infrastructure.backend.BackendErrorType;
import com.semroute.infrastructure.backend.BackendException;
import com.semroute.infrastructure.backend.Metered;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Single entry point for calls into a capability.
 *
 * <p>The ranked list is computed once per request and walked strictly in order, one backend
 * call at a time, until a call succeeds or the walk has to stop (candidates exhausted, attempt
 * limit, deadline). Every candidate considered leaves an entry in the attempt log. Outcomes are
 * reported to the health monitor and circuit breaker of the provider that produced them only.
 */
public class FailoverCoordinator {
    private static final Logger log = LoggerFactory.getLogger(FailoverCoordinator.class);

    private final ProviderRegistry registry;
    private final ProviderRouter router;
    private final ProviderStateStore store;
    private final CircuitBreaker circuitBreaker;
    private final HealthMonitor healthMonitor;
    private final CostTracker costTracker;
    private final RoutingProperties.Failover config;
    private final List<RoutingObserver> observers;
    private final Scheduler timer;

    public FailoverCoordinator(
            ProviderRegistry registry,
            ProviderRouter router,
            ProviderStateStore store,
            CircuitBreaker circuitBreaker,
            HealthMonitor healthMonitor,
            CostTracker costTracker,
            RoutingProperties.Failover config,
            List<RoutingObserver> observers,
            Scheduler timer
    ) {
        this.registry = registry;
        this.router = router;
        this.store = store;
        this.circuitBreaker = circuitBreaker;
        this.healthMonitor = healthMonitor;
        this.costTracker = costTracker;
        this.config = config;
        this.observers = observers == null ? List.of() : List.copyOf(observers);
        this.timer = timer;
    }

    public <Q, R> Mono<R> execute(Capability capability, Q request) {
        return execute(capability, request, config.requestDeadline());
    }

    public <Q, R> Mono<R> execute(Capability capability, Q request, Duration deadline) {
        return this.<Q, R>executeDetailed(capability, request, deadline).map(RoutingResult::response);
    }

    /**
     * Like {@link #execute} but keeps the winning candidate and the attempt log.
     *
     * @param deadline global budget for the whole walk; null means the configured default
     */
    public <Q, R> Mono<RoutingResult<R>> executeDetailed(Capability capability, Q request, Duration deadline) {
        Duration budget = deadline == null ? config.requestDeadline() : deadline;
        if (budget.isZero() || budget.isNegative()) {
            return Mono.error(new IllegalArgumentException("deadline must be > 0, got " + budget));
        }
        return Mono.defer(() -> {
            registry.require(capability);
            List<RankedCandidate> ranked = router.rank(capability, store.loadSnapshot());
            Run run = new Run(capability, ranked, budget);
            return Flux.fromIterable(ranked)
                    .concatMap(candidate -> this.<Q, R>attempt(run, candidate, request))
                    .next()
                    .switchIfEmpty(Mono.defer(() -> Mono.error(run.exhausted())))
                    .doOnSuccess(run::succeeded)
                    .doOnError(run::failed)
                    .doOnCancel(run::cancelledByCaller);
        });
    }

    private <Q, R> Mono<RoutingResult<R>> attempt(Run run, RankedCandidate candidate, Q request) {
        return Mono.defer(() -> {
            if (run.stopReason != null) {
                return Mono.empty();
            }
            if (run.dispatched.get() >= config.maxAttempts()) {
                run.stop("max attempts (" + config.maxAttempts() + ") reached");
                return Mono.empty();
            }
            Duration remaining = run.remaining();
            if (remaining.isZero() || remaining.isNegative() || remaining.compareTo(config.minAttemptBudget()) < 0) {
                run.stop("deadline budget exhausted (" + Math.max(0, remaining.toMillis()) + "ms left)");
                return Mono.empty();
            }

            ProviderId provider = candidate.provider();
            CircuitPermit permit = circuitBreaker.tryAcquire(provider);
            if (!permit.granted()) {
                log.debug("Candidate skipped, circuit open provider={} retryAt={}", provider, permit.retryAt());
                run.record(AttemptRecord.circuitOpen(candidate, "circuit open, retry at " + permit.retryAt()));
                return Mono.empty();
            }

            boolean deadlineBound = remaining.compareTo(config.perAttemptTimeout()) < 0;
            Duration timeout = deadlineBound ? remaining : config.perAttemptTimeout();
            BackendClient<Q, R> client = clientFor(provider);
            InFlight inFlight = run.dispatch(candidate, permit, store.load(provider).acquire(), timeout);

            return Mono.defer(() -> client.call(request))
                    .timeout(timeout, timer)
                    .switchIfEmpty(Mono.error(() -> new BackendException(provider, BackendErrorType.APPLICATION, "Empty response")))
                    .onErrorResume(e -> this.<R>onFailure(run, inFlight, e, deadlineBound))
                    .flatMap(response -> onSuccess(run, inFlight, response))
                    .doOnCancel(() -> abort(run, inFlight, "cancelled by caller"))
                    .doFinally(signal -> inFlight.lease.close());
        });
    }

    private <R> Mono<RoutingResult<R>> onSuccess(Run run, InFlight f, R response) {
        if (!f.settle()) {
            // cancelled or failed first: the attempt is already accounted for
            return Mono.empty();
        }
        ProviderId provider = f.candidate.provider();
        Duration latency = f.elapsed();
        healthMonitor.recordCallOutcome(provider, true, latency);
        circuitBreaker.onSuccess(f.permit);
        double cost = costTracker.recordUsage(provider, unitsOf(response));
        run.record(AttemptRecord.success(f.attempt, f.candidate, latency.toMillis()));
        return Mono.just(new RoutingResult<>(response, f.candidate, run.attempts, run.elapsed(), cost));
    }

    private <R> Mono<R> onFailure(Run run, InFlight f, Throwable error, boolean deadlineBound) {
        if (!f.settle()) {
            return Mono.empty();
        }
        ProviderId provider = f.candidate.provider();
        Duration latency = f.elapsed();

        if (error instanceof TimeoutException && deadlineBound) {
            // the global deadline fired, not the provider's own timeout: not the provider's fault
            circuitBreaker.release(f.permit);
            String reason = "deadline of " + run.deadline.toMillis() + "ms expired";
            run.record(AttemptRecord.cancelled(f.attempt, f.candidate, latency.toMillis(), reason));
            log.warn("Routing deadline expired capability={} attempt={} provider={}", run.capability, f.attempt, provider);
            return Mono.error(new RoutingCancelledException(run.capability, run.attempts, reason));
        }

        BackendErrorType type = classify(error);
        String message = describe(error, f.timeout);
        healthMonitor.recordCallOutcome(provider, false, latency, message);
        circuitBreaker.onFailure(f.permit);
        run.record(AttemptRecord.failed(f.attempt, f.candidate, latency.toMillis(), type, message));
        log.warn("Attempt failed capability={} attempt={} provider={} type={} latencyMs={} error={}",
                run.capability, f.attempt, provider, type, latency.toMillis(), message);
        return Mono.empty();
    }

    /** Bookkeeping for an attempt whose subscriber went away before an outcome was known. */
    private void abort(Run run, InFlight f, String reason) {
        if (!f.settle()) {
            return;
        }
        circuitBreaker.release(f.permit);
        f.lease.close();
        run.record(AttemptRecord.cancelled(f.attempt, f.candidate, f.elapsed().toMillis(), reason));
        log.info("Attempt cancelled capability={} attempt={} provider={}", run.capability, f.attempt, f.candidate.provider());
    }

    @SuppressWarnings("unchecked")
    private <Q, R> BackendClient<Q, R> clientFor(ProviderId provider) {
        return (BackendClient<Q, R>) registry.client(provider);
    }

    private static long unitsOf(Object response) {
        if (response instanceof Metered metered) {
            return Math.max(0, metered.units());
        }
        return 1;
    }

    private static BackendErrorType classify(Throwable error) {
        if (error instanceof BackendException be) return be.getType();
        if (error instanceof TimeoutException) return BackendErrorType.TIMEOUT;
        return BackendErrorType.UNKNOWN;
    }

    private static String describe(Throwable error, Duration timeout) {
        if (error instanceof BackendException be) return be.getSafeMessage();
        if (error instanceof TimeoutException) return "timed out after " + timeout.toMillis() + "ms";
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private void notifyObservers(RoutingReport report) {
        for (RoutingObserver observer : observers) {
            try {
                observer.onRoutingCompleted(report);
            } catch (RuntimeException e) {
                log.warn("Routing observer failed observer={}", observer.getClass().getSimpleName(), e);
            }
        }
    }

    private static final class InFlight {
        private final int attempt;
        private final RankedCandidate candidate;
        private final CircuitPermit permit;
        private final LoadCounter.Lease lease;
        private final Duration timeout;
        private final long startNanos = System.nanoTime();
        private final AtomicBoolean settled = new AtomicBoolean();

        private InFlight(int attempt, RankedCandidate candidate, CircuitPermit permit, LoadCounter.Lease lease, Duration timeout) {
            this.attempt = attempt;
            this.candidate = candidate;
            this.permit = permit;
            this.lease = lease;
            this.timeout = timeout;
        }

        /** True for the first caller only; success, failure and cancel race to settle. */
        boolean settle() {
            return settled.compareAndSet(false, true);
        }

        Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }
    }

    /** Mutable state of one request's walk over the ranked list. */
    private final class Run {
        private final Capability capability;
        private final List<RankedCandidate> ranked;
        private final Duration deadline;
        private final long startNanos = System.nanoTime();
        private final List<AttemptRecord> attempts = new CopyOnWriteArrayList<>();
        private final AtomicInteger dispatched = new AtomicInteger();
        private final AtomicBoolean finished = new AtomicBoolean();
        private volatile String stopReason;
        private volatile InFlight current;

        private Run(Capability capability, List<RankedCandidate> ranked, Duration deadline) {
            this.capability = capability;
            this.ranked = ranked;
            this.deadline = deadline;
        }

        InFlight dispatch(RankedCandidate candidate, CircuitPermit permit, LoadCounter.Lease lease, Duration timeout) {
            InFlight f = new InFlight(dispatched.incrementAndGet(), candidate, permit, lease, timeout);
            current = f;
            log.debug("Dispatching capability={} attempt={} provider={} score={} timeoutMs={}",
                    capability, f.attempt, candidate.provider(), candidate.score(), timeout.toMillis());
            return f;
        }

        void record(AttemptRecord record) {
            attempts.add(record);
        }

        void stop(String reason) {
            if (stopReason == null) {
                stopReason = reason;
                log.info("Failover stopped capability={} reason={}", capability, reason);
            }
        }

        Duration remaining() {
            return deadline.minus(elapsed());
        }

        Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }

        List<ProviderId> excluded() {
            Set<ProviderId> eligible = ranked.stream().map(RankedCandidate::provider).collect(Collectors.toSet());
            return registry.list(capability).stream()
                    .map(ProviderDescriptor::id)
                    .filter(id -> !eligible.contains(id))
                    .sorted(Comparator.comparing(ProviderId::name))
                    .toList();
        }

        AllProvidersFailedException exhausted() {
            return new AllProvidersFailedException(capability, attempts, excluded(), stopReason);
        }

        void succeeded(RoutingResult<?> result) {
            if (!finished.compareAndSet(false, true)) return;
            log.info("Routed capability={} provider={} attempts={} elapsedMs={}",
                    capability, result.provider(), dispatched.get(), elapsed().toMillis());
            notifyObservers(new RoutingReport(capability, RoutingReport.Outcome.SUCCESS, result.provider(),
                    result.breakdown(), attempts, excluded(), elapsed(), stopReason, result.cost()));
        }

        void failed(Throwable error) {
            if (!finished.compareAndSet(false, true)) return;
            RoutingReport.Outcome outcome = error instanceof RoutingCancelledException
                    ? RoutingReport.Outcome.CANCELLED
                    : RoutingReport.Outcome.ALL_FAILED;
            String reason = error instanceof RoutingCancelledException rce ? rce.reason() : stopReason;
            if (outcome == RoutingReport.Outcome.ALL_FAILED) {
                log.error("No provider could serve capability={} attempts={} excluded={} stopReason={}",
                        capability, dispatched.get(), excluded(), stopReason);
            }
            notifyObservers(new RoutingReport(capability, outcome, null, null, attempts, excluded(), elapsed(), reason, 0));
        }

        void cancelledByCaller() {
            InFlight f = current;
            if (f != null) {
                abort(this, f, "cancelled by caller");
            }
            if (!finished.compareAndSet(false, true)) return;
            notifyObservers(new RoutingReport(capability, RoutingReport.Outcome.CANCELLED, null, null,
                    attempts, excluded(), elapsed(), "cancelled by caller", 0));
        }
    }
}
