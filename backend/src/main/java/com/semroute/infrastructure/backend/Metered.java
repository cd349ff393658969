/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.infrastructure.backend;

/**
 * Implemented by responses that know how many billable units they consumed (tokens, bytes...).
 * Responses that don't implement it are billed as one unit.
 */
public interface Metered {
    long units();
}
