/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.result;

import com.powsybl.iidm.network.Country;
import com.powsybl.offshoregrid.network.ConnectionType;

/**
 * A built cable route. Cable ids are numbered from 1 within each connection class.
 *
 * @param country country of the landing end: hub for wind farm to hub cables, substation for export cables,
 *                first substation for peer links
 * @author Offshore grid planning developers
 */
public record CableRecord(int cableId, ConnectionType type, Country country, int fromId, int toId,
                          double fromLongitude, double fromLatitude, double toLongitude, double toLatitude,
                          double distance, double capacity, double cost, double referenceCost) {
}
