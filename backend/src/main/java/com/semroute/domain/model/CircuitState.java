/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.domain.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
