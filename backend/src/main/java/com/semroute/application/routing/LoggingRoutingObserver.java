/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.semroute.domain.model.ProviderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one JSON line per routed request: outcome, winner with its score inputs, and the
 * attempt log.
 */
@Component
public class LoggingRoutingObserver implements RoutingObserver {
    private static final Logger log = LoggerFactory.getLogger(LoggingRoutingObserver.class);

    private final ObjectMapper objectMapper;

    public LoggingRoutingObserver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void onRoutingCompleted(RoutingReport report) {
        if (!log.isInfoEnabled()) return;
        log.info("routing_decision {}", toJson(report));
    }

    String toJson(RoutingReport report) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("capability", report.capability().name());
        body.put("outcome", report.outcome().name());
        body.put("chosen", report.chosen() == null ? null : report.chosen().name());
        body.put("elapsedMs", report.elapsed().toMillis());
        body.put("cost", report.cost());
        if (report.stopReason() != null) {
            body.put("stopReason", report.stopReason());
        }
        ScoreBreakdown b = report.breakdown();
        if (b != null) {
            Map<String, Object> inputs = new LinkedHashMap<>();
            inputs.put("score", b.totalScore());
            inputs.put("quality", b.qualityScore());
            inputs.put("qualityPenalty", b.qualityPenalty());
            inputs.put("latencyScore", b.latencyScore());
            inputs.put("loadScore", b.loadScore());
            inputs.put("preferenceScore", b.preferenceScore());
            inputs.put("costScore", b.costScore());
            inputs.put("healthStatus", b.healthStatus().name());
            inputs.put("circuitState", b.circuitState().name());
            body.put("breakdown", inputs);
        }
        List<Map<String, Object>> attempts = new ArrayList<>();
        for (AttemptRecord a : report.attempts()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("attempt", a.attempt());
            entry.put("provider", a.provider().name());
            entry.put("score", a.score());
            entry.put("outcome", a.outcome().name());
            entry.put("latencyMs", a.latencyMillis());
            if (a.errorType() != null) entry.put("errorType", a.errorType().name());
            if (a.error() != null) entry.put("error", a.error());
            attempts.add(entry);
        }
        body.put("attempts", attempts);
        body.put("excluded", report.excluded().stream().map(ProviderId::name).toList());

        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.debug("Routing report serialization failed", e);
            return "{\"error\":\"routing_report_serialization_failed\"}";
        }
    }
}
