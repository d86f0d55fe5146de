/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.result;

import com.powsybl.offshoregrid.network.AssetClass;
import com.powsybl.offshoregrid.network.ConnectionType;

import java.util.*;

/**
 * Built assets of a solved stage.
 *
 * @author Offshore grid planning developers
 */
public class StageResult {

    private final int year;

    private final double objectiveValue;

    private final List<WindFarmRecord> windFarms;

    private final List<EnergyHubRecord> energyHubs;

    private final List<SubstationRecord> substations;

    private final List<CableRecord> cables;

    private final Map<AssetClass, ClassTotals> totals = new EnumMap<>(AssetClass.class);

    public StageResult(int year, double objectiveValue, List<WindFarmRecord> windFarms, List<EnergyHubRecord> energyHubs,
                       List<SubstationRecord> substations, List<CableRecord> cables) {
        this.year = year;
        this.objectiveValue = objectiveValue;
        this.windFarms = List.copyOf(windFarms);
        this.energyHubs = List.copyOf(energyHubs);
        this.substations = List.copyOf(substations);
        this.cables = List.copyOf(cables);
        for (AssetClass assetClass : AssetClass.values()) {
            totals.put(assetClass, ClassTotals.EMPTY);
        }
        this.windFarms.forEach(r -> totals.merge(AssetClass.WIND_FARM, ClassTotals.EMPTY, (t, e) -> t.add(r.capacity(), r.cost())));
        this.energyHubs.forEach(r -> totals.merge(AssetClass.ENERGY_HUB, ClassTotals.EMPTY, (t, e) -> t.add(r.capacity(), r.cost())));
        this.substations.forEach(r -> totals.merge(AssetClass.ONSHORE_SUBSTATION, ClassTotals.EMPTY, (t, e) -> t.add(r.capacity(), r.cost())));
        this.cables.forEach(r -> totals.merge(AssetClass.of(r.type()), ClassTotals.EMPTY, (t, e) -> t.add(r.capacity(), r.cost())));
    }

    public int getYear() {
        return year;
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }

    public List<WindFarmRecord> getWindFarms() {
        return windFarms;
    }

    public List<EnergyHubRecord> getEnergyHubs() {
        return energyHubs;
    }

    public List<SubstationRecord> getSubstations() {
        return substations;
    }

    public List<CableRecord> getCables() {
        return cables;
    }

    public List<CableRecord> getCables(ConnectionType type) {
        return cables.stream().filter(c -> c.type() == type).toList();
    }

    public Map<AssetClass, ClassTotals> getTotals() {
        return Collections.unmodifiableMap(totals);
    }

    public ClassTotals getTotals(AssetClass assetClass) {
        return totals.get(Objects.requireNonNull(assetClass));
    }

    /**
     * Capacity of everything built, summed over all asset classes, in MW.
     */
    public double getTotalCapacity() {
        return totals.values().stream().mapToDouble(ClassTotals::capacity).sum();
    }

    /**
     * Cost of everything built in the stage, in M€.
     */
    public double getTotalCost() {
        return totals.values().stream().mapToDouble(ClassTotals::cost).sum();
    }
}
