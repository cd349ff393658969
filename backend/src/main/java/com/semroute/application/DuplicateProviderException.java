/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application;

import com.semroute.domain.model.ProviderId;

public class DuplicateProviderException extends RoutingException {
    private final ProviderId provider;

    public DuplicateProviderException(ProviderId provider) {
        super("Provider already registered: " + provider);
        this.provider = provider;
    }

    public ProviderId provider() {
        return provider;
    }

    @Override
    public String code() {
        return "DUPLICATE_PROVIDER";
    }
}
