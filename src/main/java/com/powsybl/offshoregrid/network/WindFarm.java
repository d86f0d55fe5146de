/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.network;

import com.powsybl.iidm.network.Country;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * An offshore wind farm. Costs are given per reference year as the present value of the whole farm at its rated
 * capacity, in M€.
 *
 * @author Offshore grid planning developers
 */
public class WindFarm extends AbstractOffshoreNode {

    private final double ratedCapacity;

    private final Map<Integer, Double> costByYear;

    public WindFarm(int id, Country country, double longitude, double latitude, double ratedCapacity,
                    Map<Integer, Double> costByYear) {
        super(id, country, longitude, latitude);
        this.ratedCapacity = ratedCapacity;
        this.costByYear = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(costByYear)));
    }

    @Override
    public NodeType getType() {
        return NodeType.WIND_FARM;
    }

    /**
     * Rated capacity in MW.
     */
    public double getRatedCapacity() {
        return ratedCapacity;
    }

    public Map<Integer, Double> getCostByYear() {
        return costByYear;
    }

    public boolean hasCost(int year) {
        return costByYear.containsKey(year);
    }

    public double getCost(int year) {
        Double cost = costByYear.get(year);
        if (cost == null) {
            throw new InputDataException("No cost for wind farm " + id + " in year " + year);
        }
        return cost;
    }
}
