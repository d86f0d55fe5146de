/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.model;

import com.powsybl.iidm.network.Country;
import com.powsybl.offshoregrid.network.InputDataException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters that change from one planning stage to the next: the stage year, which selects cost coefficients
 * and discounting, and the share of each country wind capacity that has to be connected.
 *
 * @author Offshore grid planning developers
 */
public class StageParameters {

    private final int year;

    private final Map<Country, Double> countryFractions;

    public StageParameters(int year, Map<Country, Double> countryFractions) {
        this.year = year;
        Objects.requireNonNull(countryFractions);
        Map<Country, Double> fractions = new EnumMap<>(Country.class);
        countryFractions.forEach((country, fraction) -> {
            Objects.requireNonNull(country);
            if (fraction == null || !(fraction >= 0 && fraction <= 1)) {
                throw new InputDataException("Invalid capacity fraction for " + country + " in " + year + ": " + fraction);
            }
            fractions.put(country, fraction);
        });
        this.countryFractions = Collections.unmodifiableMap(fractions);
    }

    public int getYear() {
        return year;
    }

    public Map<Country, Double> getCountryFractions() {
        return countryFractions;
    }

    public double getCountryFraction(Country country) {
        return countryFractions.getOrDefault(country, 0.0);
    }

    @Override
    public String toString() {
        return "StageParameters(year=" + year + ", countryFractions=" + countryFractions + ")";
    }
}
