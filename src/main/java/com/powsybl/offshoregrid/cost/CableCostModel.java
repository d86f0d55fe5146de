/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.cost;

import com.powsybl.offshoregrid.CableCountMode;

import java.util.Objects;

/**
 * HVAC export cable cost, proportional to the number of parallel cables and the route length.
 *
 * @author Offshore grid planning developers
 */
public class CableCostModel {

    public static final double ROUTE_FACTOR = 1.10;

    /**
     * Rated capacity of one cable in MW.
     */
    public static final double CABLE_CAPACITY = 348;

    public static final double POWER_FACTOR = 0.95;

    /**
     * Equipment cost in M€/km.
     */
    public static final double EQUIPMENT_COST = 0.860;

    /**
     * Installation cost in M€/km.
     */
    public static final double INSTALLATION_COST = 0.540;

    public static final double OPERATION_RATE = 0.2 * 1e-2;

    public static final double DECOMMISSIONING_RATE = 0.5;

    private static final double COUNT_EPSILON = 1e-9;

    private final PresentValue presentValue;

    public CableCostModel(PresentValue presentValue) {
        this.presentValue = Objects.requireNonNull(presentValue);
    }

    public static double length(CableType type, double distance) {
        return ROUTE_FACTOR * distance + type.getTransitionLength();
    }

    public static double cableCount(double capacity, CableCountMode mode) {
        double count = Math.max(capacity, 0) / (CABLE_CAPACITY * POWER_FACTOR);
        return mode == CableCountMode.DISCRETE ? Math.ceil(count - COUNT_EPSILON) : count;
    }

    private double costPerCable(CableType type, double distance, int year) {
        double length = length(type, distance);
        double equipment = length * EQUIPMENT_COST;
        double installation = length * type.getInstallationCost();
        return presentValue.of(year, equipment, installation, OPERATION_RATE * equipment, DECOMMISSIONING_RATE * installation);
    }

    public LinearCost linear(CableType type, double distance, int year) {
        return new LinearCost(costPerCable(type, distance, year) / (CABLE_CAPACITY * POWER_FACTOR), 0);
    }

    public double cost(CableType type, double distance, int year, double capacity, CableCountMode mode) {
        return costPerCable(type, distance, year) * cableCount(capacity, mode);
    }
}
