/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.api.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.semroute.application.routing.FailoverCoordinator;
import com.semroute.application.routing.RoutingResult;
import com.semroute.domain.model.Capability;
import jakarta.validation.constraints.Positive;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Routes an opaque JSON request to the best available provider of a capability.
 */
@RestController
@RequestMapping("/api/routing")
public class RoutingController {
    public static final String DEADLINE_HEADER = "X-Deadline-Ms";

    private final FailoverCoordinator coordinator;

    public RoutingController(FailoverCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/{capability}")
    public Mono<RoutedResponse> route(
            @PathVariable("capability") String capability,
            @RequestHeader(value = DEADLINE_HEADER, required = false) @Positive Long deadlineMs,
            @RequestBody JsonNode body
    ) {
        Capability cap = Capability.fromPath(capability);
        Duration deadline = deadlineMs == null ? null : Duration.ofMillis(deadlineMs);
        return coordinator.<JsonNode, JsonNode>executeDetailed(cap, body, deadline)
                .map(result -> toResponse(cap, result));
    }

    private static RoutedResponse toResponse(Capability capability, RoutingResult<JsonNode> result) {
        return new RoutedResponse(
                capability.pathName(),
                result.provider().name(),
                result.chosen().score(),
                result.attempts(),
                result.elapsed().toMillis(),
                result.cost(),
                result.response()
        );
    }
}
