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
 * An onshore substation. Capacity up to the threshold is available at no cost.
 *
 * @author Offshore grid planning developers
 */
public class OnshoreSubstation extends AbstractOffshoreNode {

    private final double capacityThreshold;

    public OnshoreSubstation(int id, Country country, double longitude, double latitude, double capacityThreshold) {
        super(id, country, longitude, latitude);
        this.capacityThreshold = capacityThreshold;
    }

    @Override
    public NodeType getType() {
        return NodeType.ONSHORE_SUBSTATION;
    }

    /**
     * Capacity threshold in MW.
     */
    public double getCapacityThreshold() {
        return capacityThreshold;
    }
}
