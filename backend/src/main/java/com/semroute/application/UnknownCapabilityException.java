/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application;

import com.semroute.domain.model.Capability;

public class UnknownCapabilityException extends RoutingException {
    private final Capability capability;

    public UnknownCapabilityException(Capability capability) {
        super("No provider registered for capability " + capability);
        this.capability = capability;
    }

    public Capability capability() {
        return capability;
    }

    @Override
    public String code() {
        return "UNKNOWN_CAPABILITY";
    }
}
