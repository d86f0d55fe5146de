/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.result;

/**
 * Summed capacity (MW) and cost (M€) of an asset class.
 *
 * @author Offshore grid planning developers
 */
public record ClassTotals(double capacity, double cost) {

    public static final ClassTotals EMPTY = new ClassTotals(0, 0);

    public ClassTotals add(double capacity, double cost) {
        return new ClassTotals(this.capacity + capacity, this.cost + cost);
    }
}
