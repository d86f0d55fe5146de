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
 * @author Offshore grid planning developers
 */
public record SubstationRecord(int id, Country country, double longitude, double latitude, double capacityThreshold,
                               double capacity, double cost, double referenceCost) {
}
