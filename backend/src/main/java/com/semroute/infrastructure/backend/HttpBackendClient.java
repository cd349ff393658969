/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.infrastructure.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.semroute.domain.model.ProviderId;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;

/**
 * JSON-over-HTTP backend: POSTs the request to {@code callPath} and GETs {@code probePath}
 * for health probes. Every failure is mapped to a {@link BackendException}.
 */
public class HttpBackendClient implements BackendClient<JsonNode, JsonNode> {
    private static final Logger log = LoggerFactory.getLogger(HttpBackendClient.class);

    private final ProviderId provider;
    private final WebClient webClient;
    private final String callPath;
    private final String probePath;

    public HttpBackendClient(ProviderId provider, WebClient webClient, String callPath, String probePath) {
        this.provider = provider;
        this.webClient = webClient;
        this.callPath = callPath;
        this.probePath = probePath;
    }

    @Override
    public Mono<JsonNode> call(JsonNode request) {
        return webClient.post()
                .uri(callPath)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .switchIfEmpty(Mono.error(() -> new BackendException(provider, BackendErrorType.APPLICATION, "Empty response body")))
                .onErrorMap(e -> !(e instanceof BackendException), this::map);
    }

    @Override
    public Mono<Void> probe() {
        return webClient.get()
                .uri(probePath)
                .retrieve()
                .toBodilessEntity()
                .then()
                .onErrorMap(e -> !(e instanceof BackendException), this::map);
    }

    private BackendException map(Throwable e) {
        BackendErrorType type = BackendErrorType.UNKNOWN;
        Integer status = null;
        if (e instanceof WebClientResponseException wre) {
            status = wre.getStatusCode().value();
            if (status >= 500) type = BackendErrorType.HTTP_5XX;
            else if (status == 408) type = BackendErrorType.TIMEOUT;
            else if (status >= 400) type = BackendErrorType.VALIDATION;
        } else if (e instanceof WebClientRequestException) {
            type = isTimeout(e.getCause()) ? BackendErrorType.TIMEOUT : BackendErrorType.CONNECTION;
        } else if (isTimeout(e)) {
            type = BackendErrorType.TIMEOUT;
        }
        log.debug("Backend error provider={} type={} status={}", provider, type, status);
        String message = status == null
                ? provider.name() + " request failed (" + type + ")"
                : provider.name() + " responded HTTP " + status;
        return new BackendException(provider, type, message, e);
    }

    private static boolean isTimeout(Throwable e) {
        return e instanceof TimeoutException
                || e instanceof ReadTimeoutException
                || e instanceof WriteTimeoutException;
    }
}
