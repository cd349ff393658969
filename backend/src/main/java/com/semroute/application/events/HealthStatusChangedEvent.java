/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.events;

import com.semroute.domain.model.HealthStatus;
import com.semroute.domain.model.ProviderId;

import java.time.Instant;

public record HealthStatusChangedEvent(
        ProviderId provider,
        HealthStatus from,
        HealthStatus to,
        String reason,
        Instant at
) {}
