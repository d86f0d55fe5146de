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
 * @author Offshore grid planning developers
 */
public abstract class AbstractOffshoreNode implements OffshoreNode {

    protected final int id;

    protected final Country country;

    protected final double longitude;

    protected final double latitude;

    protected AbstractOffshoreNode(int id, Country country, double longitude, double latitude) {
        this.id = id;
        this.country = country;
        this.longitude = longitude;
        this.latitude = latitude;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public Country getCountry() {
        return country;
    }

    @Override
    public double getLongitude() {
        return longitude;
    }

    @Override
    public double getLatitude() {
        return latitude;
    }

    @Override
    public String toString() {
        return getName();
    }
}
