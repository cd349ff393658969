/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.infrastructure.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.semroute.domain.model.ProviderId;
import reactor.core.publisher.Mono;

/**
 * Always-available backend for local runs and demos. Echoes the request back.
 */
public class NullBackendClient implements BackendClient<JsonNode, JsonNode> {
    private final ProviderId provider;

    public NullBackendClient(ProviderId provider) {
        this.provider = provider;
    }

    @Override
    public Mono<JsonNode> call(JsonNode request) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("provider", provider.name());
        body.put("type", "NULL");
        body.set("echo", request == null ? JsonNodeFactory.instance.nullNode() : request);
        return Mono.just(body);
    }

    @Override
    public Mono<Void> probe() {
        return Mono.empty();
    }
}
