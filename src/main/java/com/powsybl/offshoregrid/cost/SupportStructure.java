/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.cost;

/**
 * Foundation type of an offshore platform, chosen from the water depth.
 *
 * @author Offshore grid planning developers
 */
public enum SupportStructure {
    MONOPILE,
    JACKET,
    FLOATING;

    public static final double JACKET_MIN_DEPTH = 25;

    public static final double FLOATING_MIN_DEPTH = 55;

    public static SupportStructure of(double waterDepth) {
        if (waterDepth < JACKET_MIN_DEPTH) {
            return MONOPILE;
        } else if (waterDepth < FLOATING_MIN_DEPTH) {
            return JACKET;
        }
        return FLOATING;
    }
}
