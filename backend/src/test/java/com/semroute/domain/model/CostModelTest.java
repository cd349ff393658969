/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CostModelTest {
    @Test
    void freeTierAppliesPerCall() {
        CostModel model = new CostModel(0.01, "request", 100, "usd", null);

        assertEquals(0.0, model.costOf(50), 1e-12);
        assertEquals(0.0, model.costOf(100), 1e-12);
        assertEquals(0.5, model.costOf(150), 1e-12);
        assertEquals("USD", model.currency());
    }

    @Test
    void efficiencyIsRelativeToUnitType() {
        assertEquals(1.0, CostModel.free().efficiencyScore(), 1e-12);
        assertEquals(0.5, new CostModel(0.00005, "token", 0, null, null).efficiencyScore(), 1e-9);
        assertEquals(0.0, new CostModel(5, "request", 0, null, null).efficiencyScore(), 1e-12);
    }

    @Test
    void defaultsAreFilledIn() {
        CostModel model = new CostModel(0.1, null, 0, null, null);

        assertEquals(CostModel.DEFAULT_UNIT_TYPE, model.unitType());
        assertEquals(CostModel.DEFAULT_CURRENCY, model.currency());
    }

    @Test
    void negativeValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CostModel(-1, null, 0, null, null));
        assertThrows(IllegalArgumentException.class, () -> new CostModel(0, null, -1, null, null));
        assertThrows(IllegalArgumentException.class, () -> new CostModel(0, null, 0, null, -5.0));
    }
}
