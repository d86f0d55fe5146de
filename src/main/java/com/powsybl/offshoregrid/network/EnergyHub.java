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
 * An offshore energy hub candidate site.
 *
 * @author Offshore grid planning developers
 */
public class EnergyHub extends AbstractOffshoreNode {

    private final double waterDepth;

    private final boolean iceCover;

    private final double portDistance;

    /**
     * @param waterDepth water depth in m
     * @param iceCover true if the site is exposed to sea ice
     * @param portDistance distance to the closest installation port in m
     */
    public EnergyHub(int id, Country country, double longitude, double latitude, double waterDepth, boolean iceCover,
                     double portDistance) {
        super(id, country, longitude, latitude);
        this.waterDepth = waterDepth;
        this.iceCover = iceCover;
        this.portDistance = portDistance;
    }

    @Override
    public NodeType getType() {
        return NodeType.ENERGY_HUB;
    }

    public double getWaterDepth() {
        return waterDepth;
    }

    public boolean hasIceCover() {
        return iceCover;
    }

    public double getPortDistance() {
        return portDistance;
    }
}
