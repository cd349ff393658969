/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.infrastructure.backend;

public enum BackendErrorType {
    TIMEOUT,
    CONNECTION,
    HTTP_5XX,
    VALIDATION,
    APPLICATION,
    UNKNOWN
}
