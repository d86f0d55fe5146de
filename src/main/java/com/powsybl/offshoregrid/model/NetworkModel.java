/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.model;

import com.powsybl.iidm.network.Country;
import com.powsybl.offshoregrid.cost.CostModel;
import com.powsybl.offshoregrid.cost.LinearCost;
import com.powsybl.offshoregrid.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * The linear model of a viable network together with the variables attached to each network element. The structure
 * is built once, then {@link #applyStage(StageParameters, CapacitySnapshot)} updates the country targets, the
 * objective and the capacity lower bounds before each solve.
 *
 * @author Offshore grid planning developers
 */
public class NetworkModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkModel.class);

    private final LinearModel linearModel = new LinearModel();

    private final OffshoreNetwork network;

    private final CostModel costModel;

    private final NetworkModelParameters parameters;

    final Map<WindFarm, ModelVariable> windFarmCapacity = new LinkedHashMap<>();

    final Map<WindFarm, Map<Country, ModelVariable>> allocation = new LinkedHashMap<>();

    final Map<EnergyHub, ModelVariable> hubCapacity = new LinkedHashMap<>();

    final Map<EnergyHub, ModelVariable> hubActivation = new LinkedHashMap<>();

    final Map<OnshoreSubstation, ModelVariable> substationCapacity = new LinkedHashMap<>();

    final Map<OnshoreSubstation, ModelVariable> substationCost = new LinkedHashMap<>();

    final Map<Connection, ModelVariable> connectionCapacity = new LinkedHashMap<>();

    final Map<Country, LinearConstraint> countryRequirements = new EnumMap<>(Country.class);

    final Map<OnshoreSubstation, LinearConstraint> substationCostConstraints = new LinkedHashMap<>();

    private final Map<Country, Double> ratedCapacityByCountry;

    private StageParameters stage;

    NetworkModel(OffshoreNetwork network, CostModel costModel, NetworkModelParameters parameters) {
        this.network = Objects.requireNonNull(network);
        this.costModel = Objects.requireNonNull(costModel);
        this.parameters = Objects.requireNonNull(parameters);
        this.ratedCapacityByCountry = network.getRatedCapacityByCountry();
    }

    public LinearModel getLinearModel() {
        return linearModel;
    }

    public OffshoreNetwork getNetwork() {
        return network;
    }

    public CostModel getCostModel() {
        return costModel;
    }

    public NetworkModelParameters getParameters() {
        return parameters;
    }

    public Optional<StageParameters> getStage() {
        return Optional.ofNullable(stage);
    }

    public ModelVariable getWindFarmCapacity(WindFarm windFarm) {
        return get(windFarmCapacity, windFarm);
    }

    public ModelVariable getAllocation(WindFarm windFarm, Country country) {
        return get(get(allocation, windFarm), country);
    }

    public Map<Country, ModelVariable> getAllocations(WindFarm windFarm) {
        return Collections.unmodifiableMap(get(allocation, windFarm));
    }

    public ModelVariable getHubCapacity(EnergyHub hub) {
        return get(hubCapacity, hub);
    }

    public ModelVariable getHubActivation(EnergyHub hub) {
        return get(hubActivation, hub);
    }

    public ModelVariable getSubstationCapacity(OnshoreSubstation substation) {
        return get(substationCapacity, substation);
    }

    public ModelVariable getSubstationCost(OnshoreSubstation substation) {
        return get(substationCost, substation);
    }

    public ModelVariable getConnectionCapacity(Connection connection) {
        return get(connectionCapacity, connection);
    }

    public LinearConstraint getCountryRequirement(Country country) {
        return get(countryRequirements, country);
    }

    private static <K, V> V get(Map<K, V> map, K key) {
        V value = map.get(Objects.requireNonNull(key));
        if (value == null) {
            throw new IllegalArgumentException("'" + key + "' is not part of the model");
        }
        return value;
    }

    /**
     * Total rated capacity of the viable wind farms of a country, in MW.
     */
    public double getRatedCapacity(Country country) {
        return ratedCapacityByCountry.getOrDefault(country, 0.0);
    }

    /**
     * Variables whose realized value is carried to the next stage as a lower bound.
     */
    public List<ModelVariable> getCapacityVariables() {
        List<ModelVariable> variables = new ArrayList<>();
        variables.addAll(windFarmCapacity.values());
        variables.addAll(hubCapacity.values());
        variables.addAll(substationCapacity.values());
        variables.addAll(connectionCapacity.values());
        return variables;
    }

    /**
     * Number of variables of each family, and total.
     */
    public Map<String, Integer> getVariableCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("wf_cap", windFarmCapacity.size());
        counts.put("wf_alloc", allocation.values().stream().mapToInt(Map::size).sum());
        counts.put("eh_cap", hubCapacity.size());
        counts.put("eh_active", hubActivation.size());
        counts.put("onss_cap", substationCapacity.size());
        counts.put("onss_cost", substationCost.size());
        for (ConnectionType type : ConnectionType.values()) {
            counts.put(type.getCode() + "_cap", network.getConnections(type).size());
        }
        counts.put("total", linearModel.getVariableCount());
        return counts;
    }

    /**
     * Prepare the model for the solve of a stage.
     *
     * @param stage year and country targets of the stage
     * @param lowerBounds realized capacities of the previous stage
     */
    public void applyStage(StageParameters stage, CapacitySnapshot lowerBounds) {
        this.stage = Objects.requireNonNull(stage);
        Objects.requireNonNull(lowerBounds);
        int year = stage.getYear();

        countryRequirements.forEach((country, constraint) ->
                constraint.setRhs(stage.getCountryFraction(country) * getRatedCapacity(country)));

        windFarmCapacity.forEach((windFarm, variable) ->
                variable.setObjectiveCoefficient(costModel.windFarm(windFarm, year).perUnit()));
        hubCapacity.forEach((hub, variable) -> {
            LinearCost cost = costModel.energyHub(hub, year);
            variable.setObjectiveCoefficient(cost.perUnit());
            hubActivation.get(hub).setObjectiveCoefficient(cost.fixed());
        });
        double substationRate = costModel.substationRate(year);
        substationCapacity.forEach((substation, variable) -> {
            variable.setObjectiveCoefficient(parameters.getSubstationCapacityWeight());
            substationCost.get(substation).setObjectiveCoefficient(1);
            substationCostConstraints.get(substation)
                    .setCoefficient(variable, -substationRate)
                    .setRhs(-substationRate * substation.getCapacityThreshold());
        });
        connectionCapacity.forEach((connection, variable) ->
                variable.setObjectiveCoefficient(costModel.cable(connection, year).perUnit()));

        windFarmCapacity.forEach((windFarm, variable) ->
                applyLowerBound(variable, lowerBounds.get(variable), Math.min(variable.getUpperBound(), windFarm.getRatedCapacity())));
        for (Map<?, ModelVariable> variables : List.<Map<?, ModelVariable>>of(hubCapacity, substationCapacity, connectionCapacity)) {
            variables.values().forEach(variable -> applyLowerBound(variable, lowerBounds.get(variable), variable.getUpperBound()));
        }
        LOGGER.debug("Model updated for year {}: {}", year, stage.getCountryFractions());
    }

    /**
     * A rounded previous capacity can exceed a non integer limit, in which case the limit is the bound.
     */
    private static void applyLowerBound(ModelVariable variable, double lowerBound, double limit) {
        if (lowerBound > limit) {
            LOGGER.debug("Lower bound {} of variable {} clamped to its limit {}", lowerBound, variable, limit);
            variable.setLowerBound(limit);
        } else {
            variable.setLowerBound(lowerBound);
        }
    }
}
