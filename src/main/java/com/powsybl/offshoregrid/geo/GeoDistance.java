/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.geo;

import com.powsybl.offshoregrid.network.OffshoreNode;

/**
 * Great-circle distance on a spherical Earth.
 *
 * @author Offshore grid planning developers
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_KM = 6371;

    private GeoDistance() {
    }

    /**
     * Haversine distance in km between two points given in decimal degrees.
     */
    public static double distance(double longitude1, double latitude1, double longitude2, double latitude2) {
        double phi1 = Math.toRadians(latitude1);
        double phi2 = Math.toRadians(latitude2);
        double dPhi = phi2 - phi1;
        double dLambda = Math.toRadians(longitude2 - longitude1);
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        // rounding may push a slightly above 1 for antipodal points
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(Math.min(1, a)));
    }

    public static double distance(OffshoreNode node1, OffshoreNode node2) {
        return distance(node1.getLongitude(), node1.getLatitude(), node2.getLongitude(), node2.getLatitude());
    }
}
