/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application.routing;

import com.semroute.domain.model.ProviderId;

public interface ProviderHealthReader {
    ProviderSnapshot getSnapshot(ProviderId provider);
}
