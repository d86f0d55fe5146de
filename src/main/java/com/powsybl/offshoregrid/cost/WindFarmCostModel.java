/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.cost;

import com.powsybl.offshoregrid.network.WindFarm;

/**
 * Wind farm cost is proportional to the selected share of the rated capacity.
 *
 * @author Offshore grid planning developers
 */
public final class WindFarmCostModel {

    private WindFarmCostModel() {
    }

    public static LinearCost linear(WindFarm windFarm, int year) {
        return new LinearCost(windFarm.getCost(year) / windFarm.getRatedCapacity(), 0);
    }

    public static double cost(WindFarm windFarm, int year, double capacity) {
        return linear(windFarm, year).evaluate(capacity, false);
    }
}
