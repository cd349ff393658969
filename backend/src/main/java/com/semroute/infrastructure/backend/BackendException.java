/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.infrastructure.backend;

import com.semroute.domain.model.ProviderId;

public class BackendException extends RuntimeException {
    private final ProviderId provider;
    private final BackendErrorType type;
    private final String safeMessage;

    public BackendException(ProviderId provider, BackendErrorType type, String safeMessage, Throwable cause) {
        super(safeMessage, cause);
        this.provider = provider;
        this.type = type;
        this.safeMessage = safeMessage;
    }

    public BackendException(ProviderId provider, BackendErrorType type, String safeMessage) {
        this(provider, type, safeMessage, null);
    }

    public ProviderId getProvider() {
        return provider;
    }

    public BackendErrorType getType() {
        return type;
    }

    public String getSafeMessage() {
        return safeMessage;
    }
}
