/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.cost;

import com.powsybl.offshoregrid.network.EnergyHub;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Energy hub cost: support structure and converter equipment proportional to the capacity, and vessel based
 * installation and decommissioning charged once when the hub is built.
 *
 * @author Offshore grid planning developers
 */
public class EnergyHubCostModel {

    /**
     * Converter cost increase for ice covered sites.
     */
    public static final double ICE_COVER_FACTOR = 1 + 0.4 * 0.5714;

    public static final double OPERATION_RATE = 0.03;

    private record SupportCoefficients(double c1, double c2, double c3) {

        /**
         * Cost per MW in €.
         */
        double cost(double depth) {
            return c1 * depth * depth + c2 * depth + c3 * 1e3;
        }
    }

    private record YearCoefficients(Map<SupportStructure, SupportCoefficients> support, double converterCost) {
    }

    private record Vessel(double c1, double c2, double c3, double c4, double c5) {

        /**
         * Vessel cost in € for a round trip to a port at the given distance in km.
         */
        double cost(double portDistanceKm) {
            return ((1 / c1) * ((2 * portDistanceKm) / c2 + c3) + c4) * ((c5 * 1e3) / 24);
        }
    }

    private static final Vessel PSIV = new Vessel(1, 18.5, 24, 144, 200);
    private static final Vessel TUG = new Vessel(1.0 / 3, 7.5, 5, 0, 2.5);
    private static final Vessel AHV_INSTALLATION = new Vessel(7, 18.5, 30, 90, 40);
    private static final Vessel AHV_DECOMMISSIONING = new Vessel(7, 18.5, 30, 30, 40);

    private static final NavigableMap<Integer, YearCoefficients> COEFFICIENTS = new TreeMap<>();

    static {
        COEFFICIENTS.put(2030, yearCoefficients(new SupportCoefficients(181, 552, 370),
                new SupportCoefficients(103, -2043, 478), new SupportCoefficients(0, 697, 1223), 1200e3));
        COEFFICIENTS.put(2040, yearCoefficients(new SupportCoefficients(176, 536, 270),
                new SupportCoefficients(100, -1986, 375), new SupportCoefficients(0, 678, 1034), 1100e3));
        COEFFICIENTS.put(2050, yearCoefficients(new SupportCoefficients(171, 521, 170),
                new SupportCoefficients(97, -1930, 658), new SupportCoefficients(0, 658, 844), 1000e3));
    }

    private static YearCoefficients yearCoefficients(SupportCoefficients monopile, SupportCoefficients jacket,
                                                     SupportCoefficients floating, double converterCost) {
        Map<SupportStructure, SupportCoefficients> support = new EnumMap<>(SupportStructure.class);
        support.put(SupportStructure.MONOPILE, monopile);
        support.put(SupportStructure.JACKET, jacket);
        support.put(SupportStructure.FLOATING, floating);
        return new YearCoefficients(support, converterCost);
    }

    private final PresentValue presentValue;

    public EnergyHubCostModel(PresentValue presentValue) {
        this.presentValue = Objects.requireNonNull(presentValue);
    }

    /**
     * Technology costs of the latest reference year not after the given one, or of the first reference year.
     */
    private static YearCoefficients getCoefficients(int year) {
        Map.Entry<Integer, YearCoefficients> e = COEFFICIENTS.floorEntry(year);
        return e != null ? e.getValue() : COEFFICIENTS.firstEntry().getValue();
    }

    /**
     * Converter cost per MW in M€.
     */
    static double converterCost(EnergyHub hub, int year) {
        double cost = getCoefficients(year).converterCost();
        if (hub.hasIceCover()) {
            cost *= ICE_COVER_FACTOR;
        }
        return cost * 1e-6;
    }

    /**
     * Support structure cost per MW in M€.
     */
    static double supportCost(EnergyHub hub, int year) {
        SupportStructure structure = SupportStructure.of(hub.getWaterDepth());
        return getCoefficients(year).support().get(structure).cost(hub.getWaterDepth()) * 1e-6;
    }

    private static List<Vessel> getVessels(SupportStructure structure, boolean installation) {
        if (structure == SupportStructure.FLOATING) {
            return List.of(TUG, installation ? AHV_INSTALLATION : AHV_DECOMMISSIONING);
        }
        return List.of(PSIV);
    }

    /**
     * Installation or decommissioning cost in M€.
     */
    static double vesselCost(EnergyHub hub, boolean installation) {
        double portDistanceKm = hub.getPortDistance() * 1e-3;
        return getVessels(SupportStructure.of(hub.getWaterDepth()), installation).stream()
                .mapToDouble(vessel -> vessel.cost(portDistanceKm))
                .sum() * 1e-6;
    }

    public LinearCost linear(EnergyHub hub, int year) {
        double converter = converterCost(hub, year);
        double perUnit = presentValue.of(year, supportCost(hub, year) + converter, 0, OPERATION_RATE * converter, 0);
        double fixed = presentValue.of(year, 0, vesselCost(hub, true), 0, vesselCost(hub, false));
        return new LinearCost(perUnit, fixed);
    }

    public double cost(EnergyHub hub, int year, double capacity, boolean built) {
        return linear(hub, year).evaluate(capacity, built);
    }
}
