/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.model;

import com.powsybl.iidm.network.Country;
import com.powsybl.offshoregrid.network.InputDataException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Offshore grid planning developers
 */
class CapacitySnapshotTest {

    @Test
    void testRounding() {
        LinearModel model = new LinearModel();
        ModelVariable a = model.addContinuousVariable("a", 0, 100);
        ModelVariable b = model.addContinuousVariable("b", 0, 100);
        ModelVariable c = model.addContinuousVariable("c", 0, 100);
        ModelVariable d = model.addContinuousVariable("d", 0, 100);
        CapacitySnapshot snapshot = CapacitySnapshot.of(List.of(a, b, c, d), new double[] {53.9999, 0.0005, 12.4, 2.5}, 1e-3);
        assertEquals(54, snapshot.get(a), 0);
        assertEquals(0, snapshot.get(b), 0);
        assertEquals(12, snapshot.get(c), 0);
        assertEquals(2, snapshot.get(d), 0);
        assertEquals(3, snapshot.getCapacities().size());
        assertFalse(snapshot.isEmpty());
        assertEquals(0, snapshot.get("unknown"), 0);
        assertTrue(CapacitySnapshot.EMPTY.isEmpty());
    }

    @Test
    void testStageParameters() {
        StageParameters stage = new StageParameters(2030, Map.of(Country.DE, 0.5, Country.PL, 1.0));
        assertEquals(2030, stage.getYear());
        assertEquals(0.5, stage.getCountryFraction(Country.DE), 0);
        assertEquals(0, stage.getCountryFraction(Country.SE), 0);

        assertThrows(InputDataException.class, () -> new StageParameters(2030, Map.of(Country.DE, 1.2)));
        assertThrows(InputDataException.class, () -> new StageParameters(2030, Map.of(Country.DE, -0.1)));
        Map<Country, Double> withNull = new HashMap<>();
        withNull.put(Country.DE, null);
        assertThrows(InputDataException.class, () -> new StageParameters(2030, withNull));
    }
}
