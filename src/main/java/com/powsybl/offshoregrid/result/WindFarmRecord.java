/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.result;

import com.powsybl.iidm.network.Country;

/**
 * @param capacity realized capacity in MW
 * @param cost cost of the capacity added in the stage, in M€
 * @param rate share of the rated capacity selected
 * @param referenceCost cost of the realized capacity at the reference year, in M€
 * @author Offshore grid planning developers
 */
public record WindFarmRecord(int id, Country country, double longitude, double latitude, double capacity, double cost,
                             double rate, double referenceCost) {
}
