/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

public enum AttemptOutcome {
    SUCCESS,
    FAILED,
    TIMEOUT,
    /** Skipped without a call; not counted against the attempt limit. */
    CIRCUIT_OPEN,
    CANCELLED
}
