/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.cost;

import java.util.Objects;

/**
 * Lifecycle cost discounted to the base year. Capital and installation costs are spent in the first year,
 * operation costs in each year of the lifetime and decommissioning costs in the last one.
 *
 * @author Offshore grid planning developers
 */
public class PresentValue {

    private final CostParameters parameters;

    public PresentValue(CostParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public CostParameters getParameters() {
        return parameters;
    }

    public double discountFactor(int year) {
        return Math.pow(1 + parameters.getDiscountRate(), -(double) (year - parameters.getBaseYear()));
    }

    private double operationFactor(int firstYear) {
        double factor = 0;
        for (int t = 1; t <= parameters.getLifetime(); t++) {
            factor += discountFactor(firstYear + t);
        }
        return factor;
    }

    public double of(int firstYear, double equipment, double installation, double yearlyOperation, double decommissioning) {
        return (equipment + installation) * discountFactor(firstYear)
                + yearlyOperation * operationFactor(firstYear)
                + decommissioning * discountFactor(firstYear + parameters.getLifetime());
    }
}
