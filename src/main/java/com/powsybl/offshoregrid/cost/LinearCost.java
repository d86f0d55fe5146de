/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.cost;

/**
 * Linear form of a cost function: a cost per MW plus a fixed part charged when the asset is built.
 *
 * @author Offshore grid planning developers
 */
public record LinearCost(double perUnit, double fixed) {

    public static final LinearCost ZERO = new LinearCost(0, 0);

    public double evaluate(double capacity, boolean built) {
        return perUnit * Math.max(capacity, 0) + (built ? fixed : 0);
    }

    public LinearCost scale(double factor) {
        return new LinearCost(perUnit * factor, fixed * factor);
    }
}
