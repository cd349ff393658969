/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.events;

import com.semroute.domain.model.CircuitState;
import com.semroute.domain.model.ProviderId;

import java.time.Duration;
import java.time.Instant;

public record CircuitTransitionEvent(
        ProviderId provider,
        CircuitState from,
        CircuitState to,
        Duration cooldown,
        Instant at
) {}
