/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.infrastructure.backend;

import reactor.core.publisher.Mono;

/**
 * Request/response adapter for one backend instance (embedding generator, vector store...).
 * Implementations must not block the subscribing thread and should fail with
 * {@link BackendException} so the failure cause survives into the attempt log.
 */
public interface BackendClient<Q, R> {
    Mono<R> call(Q request);

    /** Lightweight synthetic call used by the health monitor. */
    Mono<Void> probe();
}
