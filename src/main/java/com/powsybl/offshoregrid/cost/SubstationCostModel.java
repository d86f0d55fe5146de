/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.cost;

import com.powsybl.offshoregrid.network.OnshoreSubstation;

import java.util.Objects;

/**
 * Onshore substation expansion cost, charged on the capacity above the free threshold.
 *
 * @author Offshore grid planning developers
 */
public class SubstationCostModel {

    /**
     * Equipment cost in M€/MW.
     */
    public static final double EQUIPMENT_COST = 0.02287;

    public static final double OPERATION_RATE = 0.015;

    private final PresentValue presentValue;

    public SubstationCostModel(PresentValue presentValue) {
        this.presentValue = Objects.requireNonNull(presentValue);
    }

    /**
     * Present value per MW above the threshold.
     */
    public double rate(int year) {
        return presentValue.of(year, EQUIPMENT_COST, 0, OPERATION_RATE * EQUIPMENT_COST, 0);
    }

    public double cost(OnshoreSubstation substation, int year, double capacity) {
        return rate(year) * Math.max(capacity - substation.getCapacityThreshold(), 0);
    }
}
