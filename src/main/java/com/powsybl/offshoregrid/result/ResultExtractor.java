/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.result;

import com.powsybl.offshoregrid.CableCountMode;
import com.powsybl.offshoregrid.cost.CostModel;
import com.powsybl.offshoregrid.model.CapacitySnapshot;
import com.powsybl.offshoregrid.model.ModelVariable;
import com.powsybl.offshoregrid.model.NetworkModel;
import com.powsybl.offshoregrid.model.StageParameters;
import com.powsybl.offshoregrid.network.*;
import com.powsybl.offshoregrid.solver.MipSolverResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the solution of a stage into records of the assets built. Costs are recomputed at the stage year on the
 * capacity added since the previous stage.
 *
 * @author Offshore grid planning developers
 */
public class ResultExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultExtractor.class);

    private static final double ROUNDING = 1e6;

    private static final double COUNT_EPSILON = 1e-9;

    private final NetworkModel networkModel;

    private final CableCountMode cableCountMode;

    private final double turbineCapacity;

    private final int referenceYear;

    private final double zeroThreshold;

    /**
     * @param turbineCapacity unit turbine capacity in MW, used to round wind farm capacities in discrete mode
     * @param referenceYear year at which reference costs of the realized capacities are computed
     */
    public ResultExtractor(NetworkModel networkModel, CableCountMode cableCountMode, double turbineCapacity, int referenceYear) {
        this.networkModel = Objects.requireNonNull(networkModel);
        this.cableCountMode = Objects.requireNonNull(cableCountMode);
        if (!(turbineCapacity > 0)) {
            throw new IllegalArgumentException("Invalid turbine capacity: " + turbineCapacity);
        }
        this.turbineCapacity = turbineCapacity;
        this.referenceYear = referenceYear;
        this.zeroThreshold = networkModel.getParameters().getZeroThreshold();
    }

    static double round(double value) {
        return Math.round(value * ROUNDING) / ROUNDING;
    }

    private double turbineCapacity(double capacity) {
        if (cableCountMode == CableCountMode.DISCRETE) {
            return Math.ceil(capacity / turbineCapacity - COUNT_EPSILON) * turbineCapacity;
        }
        return capacity;
    }

    public StageResult extract(StageParameters stage, MipSolverResult result, CapacitySnapshot previous) {
        Objects.requireNonNull(stage);
        Objects.requireNonNull(result);
        Objects.requireNonNull(previous);
        if (!result.isUsable()) {
            throw new IllegalArgumentException("Cannot extract results from a " + result.getStatus() + " solution");
        }
        int year = stage.getYear();
        OffshoreNetwork network = networkModel.getNetwork();
        CostModel costModel = networkModel.getCostModel();

        List<WindFarmRecord> windFarms = new ArrayList<>();
        for (WindFarm windFarm : network.getWindFarms()) {
            ModelVariable variable = networkModel.getWindFarmCapacity(windFarm);
            double capacity = result.getValue(variable);
            if (capacity > zeroThreshold) {
                double added = turbineCapacity(Math.max(capacity - previous.get(variable), 0));
                windFarms.add(new WindFarmRecord(windFarm.getId(), windFarm.getCountry(), windFarm.getLongitude(), windFarm.getLatitude(),
                        round(capacity),
                        costModel.windFarmCost(windFarm, year, added),
                        round(capacity / windFarm.getRatedCapacity()),
                        costModel.windFarmCost(windFarm, referenceYear, turbineCapacity(capacity))));
            }
        }

        List<EnergyHubRecord> energyHubs = new ArrayList<>();
        for (EnergyHub hub : network.getEnergyHubs()) {
            ModelVariable variable = networkModel.getHubCapacity(hub);
            double capacity = result.getValue(variable);
            if (capacity > zeroThreshold) {
                double previousCapacity = previous.get(variable);
                boolean active = result.getValue(networkModel.getHubActivation(hub)) > 0.5;
                // fixed installation cost only in the stage where the hub is first built
                boolean firstBuilt = active && previousCapacity <= zeroThreshold;
                energyHubs.add(new EnergyHubRecord(hub.getId(), hub.getCountry(), hub.getLongitude(), hub.getLatitude(),
                        hub.getWaterDepth(), hub.hasIceCover(), hub.getPortDistance(),
                        round(capacity),
                        costModel.energyHubCost(hub, year, Math.max(capacity - previousCapacity, 0), firstBuilt),
                        costModel.energyHubCost(hub, referenceYear, capacity, active)));
            }
        }

        List<SubstationRecord> substations = new ArrayList<>();
        for (OnshoreSubstation substation : network.getSubstations()) {
            ModelVariable variable = networkModel.getSubstationCapacity(substation);
            double capacity = result.getValue(variable);
            if (capacity > zeroThreshold) {
                double added = costModel.substationCost(substation, year, capacity)
                        - costModel.substationCost(substation, year, previous.get(variable));
                substations.add(new SubstationRecord(substation.getId(), substation.getCountry(), substation.getLongitude(),
                        substation.getLatitude(), substation.getCapacityThreshold(),
                        round(capacity),
                        Math.max(added, 0),
                        costModel.substationCost(substation, referenceYear, capacity)));
            }
        }

        List<CableRecord> cables = new ArrayList<>();
        Map<ConnectionType, Integer> counters = new EnumMap<>(ConnectionType.class);
        for (Connection connection : network.getConnections()) {
            ModelVariable variable = networkModel.getConnectionCapacity(connection);
            double capacity = result.getValue(variable);
            if (capacity > zeroThreshold) {
                int cableId = counters.merge(connection.getType(), 1, Integer::sum);
                OffshoreNode source = connection.getSource();
                OffshoreNode target = connection.getTarget();
                OffshoreNode landing = connection.getType() == ConnectionType.ONSS_ONSS ? source : target;
                double added = Math.max(capacity - previous.get(variable), 0);
                cables.add(new CableRecord(cableId, connection.getType(), landing.getCountry(), source.getId(), target.getId(),
                        source.getLongitude(), source.getLatitude(), target.getLongitude(), target.getLatitude(),
                        connection.getDistance(),
                        round(capacity),
                        costModel.cableCost(connection, year, added, cableCountMode),
                        costModel.cableCost(connection, referenceYear, capacity, cableCountMode)));
            }
        }

        StageResult stageResult = new StageResult(year, result.getObjectiveValue(), windFarms, energyHubs, substations, cables);
        LOGGER.debug("Stage {}: {} wind farms, {} energy hubs, {} substations, {} cables built, cost {} M€", year,
                windFarms.size(), energyHubs.size(), substations.size(), cables.size(), stageResult.getTotalCost());
        return stageResult;
    }
}
