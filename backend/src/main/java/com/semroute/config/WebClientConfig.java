/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.config;

import com.semroute.infrastructure.backend.BackendClientFactory;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {
    private static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

    @Bean
    public HttpClient backendHttpClient(RoutingProperties properties) {
        // the failover coordinator enforces the real per-attempt deadline; this only guards leaked connections
        Duration responseTimeout = properties.failover().perAttemptTimeout().multipliedBy(2);
        long timeoutMillis = responseTimeout.toMillis();
        return HttpClient.create()
                .responseTimeout(responseTimeout)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS)));
    }

    @Bean
    public ExchangeStrategies backendExchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();
    }

    @Bean
    public BackendClientFactory backendClientFactory(HttpClient backendHttpClient, ExchangeStrategies backendExchangeStrategies) {
        return new BackendClientFactory(backendHttpClient, backendExchangeStrategies);
    }
}
