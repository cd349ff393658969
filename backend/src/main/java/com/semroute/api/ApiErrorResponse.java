/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
        String error,
        String code,
        String message,
        String requestId,
        Object details
) {}
