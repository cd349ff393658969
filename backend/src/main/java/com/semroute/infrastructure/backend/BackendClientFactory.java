/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.infrastructure.backend;

import com.semroute.config.RoutingProperties;
import com.semroute.domain.model.ProviderId;
import io.netty.channel.ChannelOption;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Builds the {@link BackendClient} for a configured provider.
 */
public class BackendClientFactory {
    private final HttpClient httpClient;
    private final ExchangeStrategies exchangeStrategies;

    public BackendClientFactory(HttpClient httpClient, ExchangeStrategies exchangeStrategies) {
        this.httpClient = httpClient;
        this.exchangeStrategies = exchangeStrategies;
    }

    public BackendClient<?, ?> create(ProviderId provider, RoutingProperties.Client client) {
        return switch (client.type()) {
            case NULL -> new NullBackendClient(provider);
            case HTTP -> new HttpBackendClient(provider, webClient(client), client.callPath(), client.probePath());
        };
    }

    private WebClient webClient(RoutingProperties.Client client) {
        HttpClient configured = httpClient
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(client.connectTimeout().toMillis()));
        return WebClient.builder()
                .baseUrl(client.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(configured))
                .exchangeStrategies(exchangeStrategies)
                .build();
    }
}
