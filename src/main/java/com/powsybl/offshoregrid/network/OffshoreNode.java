/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.network;

import com.powsybl.iidm.network.Country;

/**
 * A located asset of the offshore transmission network.
 *
 * @author Offshore grid planning developers
 */
public interface OffshoreNode {

    int getId();

    NodeType getType();

    Country getCountry();

    /**
     * Longitude in decimal degrees.
     */
    double getLongitude();

    /**
     * Latitude in decimal degrees.
     */
    double getLatitude();

    /**
     * Unique name among all nodes, used to name model variables.
     */
    default String getName() {
        return getType().getCode() + "_" + getId();
    }
}
