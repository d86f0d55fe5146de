/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid;

/**
 * How the number of parallel cables and wind turbines is counted when costs are reported.
 *
 * @author Offshore grid planning developers
 */
public enum CableCountMode {
    /**
     * Fractional counts, as in the optimization model.
     */
    CONTINUOUS,
    /**
     * Counts rounded up to whole cables and whole turbines.
     */
    DISCRETE
}
