/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.semroute.domain.model.Capability;
import com.semroute.domain.model.ProviderId;
import com.semroute.infrastructure.backend.BackendErrorType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoggingRoutingObserverTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void failedRequestCarriesAttemptLogAndStopReason() throws Exception {
        ProviderId a = ProviderId.of(Capability.VECTOR_STORE, "qdrant");
        ProviderId b = ProviderId.of(Capability.VECTOR_STORE, "pgvector");
        RoutingReport report = new RoutingReport(Capability.VECTOR_STORE, RoutingReport.Outcome.ALL_FAILED, null, null,
                List.of(new AttemptRecord(1, a, 0.8, AttemptOutcome.FAILED, 12, BackendErrorType.CONNECTION, "refused")),
                List.of(b), Duration.ofMillis(15), "max attempts (1) reached", 0);

        JsonNode json = mapper.readTree(new LoggingRoutingObserver(mapper).toJson(report));

        assertEquals("ALL_FAILED", json.path("outcome").asText());
        assertTrue(json.path("chosen").isNull());
        assertFalse(json.has("breakdown"));
        assertEquals("max attempts (1) reached", json.path("stopReason").asText());
        assertEquals("CONNECTION", json.path("attempts").get(0).path("errorType").asText());
        assertEquals("pgvector", json.path("excluded").get(0).asText());
    }
}
