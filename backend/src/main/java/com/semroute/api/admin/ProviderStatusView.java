/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.api.admin;

import com.semroute.application.cost.UsageMetrics;
import com.semroute.domain.model.CircuitSnapshot;
import com.semroute.domain.model.CircuitState;
import com.semroute.domain.model.HealthRecord;
import com.semroute.domain.model.ProviderDescriptor;

public record ProviderStatusView(
        String capability,
        String name,
        ProviderDescriptor descriptor,
        HealthRecord health,
        CircuitSnapshot circuit,
        CircuitState effectiveCircuitState,
        int inFlight,
        UsageMetrics usage,
        boolean withinBudget
) {}
