/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.state;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-flight request count of one provider. A scoring signal only, never an admission gate.
 */
public class LoadCounter {
    private final AtomicInteger inFlight = new AtomicInteger();

    public int get() {
        return inFlight.get();
    }

    /**
     * Increments the counter and returns a lease that decrements it exactly once, however many
     * times it is closed (completion, error and cancel may all fire).
     */
    public Lease acquire() {
        inFlight.incrementAndGet();
        return new Lease();
    }

    private void release() {
        inFlight.updateAndGet(v -> v > 0 ? v - 1 : 0);
    }

    public final class Lease implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease() {}

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release();
            }
        }
    }
}
