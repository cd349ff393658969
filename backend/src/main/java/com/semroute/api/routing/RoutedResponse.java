/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.api.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.semroute.application.routing.AttemptRecord;

import java.util.List;

public record RoutedResponse(
        String capability,
        String provider,
        double score,
        List<AttemptRecord> attempts,
        long elapsedMs,
        double cost,
        JsonNode body
) {}
