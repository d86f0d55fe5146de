/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Wind farm, energy hub and onshore substation data indexed by id.
 *
 * @author Offshore grid planning developers
 */
public class NetworkDatasets {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkDatasets.class);

    private final Map<Integer, WindFarm> windFarms;

    private final Map<Integer, EnergyHub> energyHubs;

    private final Map<Integer, OnshoreSubstation> substations;

    public NetworkDatasets(Collection<WindFarm> windFarms, Collection<EnergyHub> energyHubs,
                           Collection<OnshoreSubstation> substations) {
        this.windFarms = index(windFarms, "wind farm");
        this.energyHubs = index(energyHubs, "energy hub");
        this.substations = index(substations, "onshore substation");
    }

    private static <T extends OffshoreNode> Map<Integer, T> index(Collection<T> nodes, String label) {
        Objects.requireNonNull(nodes);
        Map<Integer, T> indexed = new TreeMap<>();
        for (T node : nodes) {
            Objects.requireNonNull(node);
            if (indexed.put(node.getId(), node) != null) {
                throw new InputDataException("Duplicate " + label + " id " + node.getId());
            }
        }
        return Collections.unmodifiableMap(indexed);
    }

    public Map<Integer, WindFarm> getWindFarms() {
        return windFarms;
    }

    public Map<Integer, EnergyHub> getEnergyHubs() {
        return energyHubs;
    }

    public Map<Integer, OnshoreSubstation> getSubstations() {
        return substations;
    }

    /**
     * Check every entity before a model is built.
     *
     * @param costYears reference years for which each wind farm must carry a cost
     * @throws InputDataException listing all the problems found
     */
    public void validate(Collection<Integer> costYears) {
        Objects.requireNonNull(costYears);
        List<String> errors = new ArrayList<>();
        for (WindFarm windFarm : windFarms.values()) {
            checkLocation(windFarm, errors);
            if (!(windFarm.getRatedCapacity() > 0) || Double.isInfinite(windFarm.getRatedCapacity())) {
                errors.add(windFarm + ": rated capacity must be positive and finite (" + windFarm.getRatedCapacity() + ")");
            }
            for (int year : costYears) {
                if (!windFarm.hasCost(year)) {
                    errors.add(windFarm + ": missing cost for year " + year);
                } else {
                    checkNonNegative(windFarm, "cost " + year, windFarm.getCost(year), errors);
                }
            }
        }
        for (EnergyHub hub : energyHubs.values()) {
            checkLocation(hub, errors);
            checkNonNegative(hub, "water depth", hub.getWaterDepth(), errors);
            checkNonNegative(hub, "port distance", hub.getPortDistance(), errors);
        }
        for (OnshoreSubstation substation : substations.values()) {
            checkLocation(substation, errors);
            checkNonNegative(substation, "capacity threshold", substation.getCapacityThreshold(), errors);
        }
        if (!errors.isEmpty()) {
            errors.forEach(LOGGER::error);
            throw new InputDataException("Invalid input data: " + String.join("; ", errors));
        }
        LOGGER.info("Input data: {} wind farms, {} energy hubs, {} onshore substations",
                windFarms.size(), energyHubs.size(), substations.size());
    }

    private static void checkLocation(OffshoreNode node, List<String> errors) {
        if (node.getCountry() == null) {
            errors.add(node + ": missing country");
        }
        double lon = node.getLongitude();
        double lat = node.getLatitude();
        if (Double.isNaN(lon) || lon < -180 || lon > 180) {
            errors.add(node + ": invalid longitude " + lon);
        }
        if (Double.isNaN(lat) || lat < -90 || lat > 90) {
            errors.add(node + ": invalid latitude " + lat);
        }
    }

    private static void checkNonNegative(OffshoreNode node, String name, double value, List<String> errors) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            errors.add(node + ": " + name + " must be non negative and finite (" + value + ")");
        }
    }
}
