/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.model;

import com.powsybl.iidm.network.Country;
import com.powsybl.offshoregrid.CrossBorderMode;
import com.powsybl.offshoregrid.ModelType;
import com.powsybl.offshoregrid.cost.CostModel;
import com.powsybl.offshoregrid.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates the variables and constraints of the capacity expansion model of a viable network.
 *
 * @author Offshore grid planning developers
 */
public class NetworkModelBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkModelBuilder.class);

    private final CostModel costModel;

    private final NetworkModelParameters parameters;

    public NetworkModelBuilder(CostModel costModel, NetworkModelParameters parameters) {
        this.costModel = Objects.requireNonNull(costModel);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public NetworkModel build(OffshoreNetwork network) {
        Objects.requireNonNull(network);
        NetworkModel model = new NetworkModel(network, costModel, parameters);
        createVariables(model);
        createCountryRequirements(model);
        createWindFarmConstraints(model);
        createHubConstraints(model);
        createSubstationConstraints(model);

        LinearModel linearModel = model.getLinearModel();
        LOGGER.info("Network model built ({}, {}): {} variables, {} constraints", parameters.getModelType(),
                parameters.getCrossBorderMode(), linearModel.getVariableCount(), linearModel.getConstraintCount());
        LOGGER.debug("Variable counts: {}", model.getVariableCounts());
        return model;
    }

    private void createVariables(NetworkModel model) {
        OffshoreNetwork network = model.getNetwork();
        LinearModel linearModel = model.getLinearModel();
        ModelType modelType = parameters.getModelType();

        for (WindFarm windFarm : network.getWindFarms()) {
            model.windFarmCapacity.put(windFarm, linearModel.addContinuousVariable(windFarm.getName() + "_cap", 0, Double.POSITIVE_INFINITY));
            Map<Country, ModelVariable> allocations = new EnumMap<>(Country.class);
            for (Country country : parameters.getCountries()) {
                allocations.put(country, linearModel.addContinuousVariable("alloc_" + windFarm.getId() + "_" + country.name(), 0, Double.POSITIVE_INFINITY));
            }
            model.allocation.put(windFarm, allocations);
        }

        // unused topology groups are kept with zero bounds so that all variants share the same structure
        double hubUpperBound = modelType.isHubAllowed() ? parameters.getHubCapacityLimit() : 0;
        for (EnergyHub hub : network.getEnergyHubs()) {
            model.hubCapacity.put(hub, linearModel.addContinuousVariable(hub.getName() + "_cap", 0, hubUpperBound));
            model.hubActivation.put(hub, linearModel.addBinaryVariable(hub.getName() + "_active")
                    .setUpperBound(modelType.isHubAllowed() ? 1 : 0));
        }

        for (OnshoreSubstation substation : network.getSubstations()) {
            double limit = parameters.getSubstationCapacityFactor() * substation.getCapacityThreshold();
            model.substationCapacity.put(substation, linearModel.addContinuousVariable(substation.getName() + "_cap", 0, limit));
            model.substationCost.put(substation, linearModel.addContinuousVariable(substation.getName() + "_cost", 0, Double.POSITIVE_INFINITY));
        }

        for (ConnectionType type : ConnectionType.values()) {
            double upperBound = isAllowed(type, modelType) ? Double.POSITIVE_INFINITY : 0;
            for (Connection connection : network.getConnections(type)) {
                model.connectionCapacity.put(connection, linearModel.addContinuousVariable(connection.getName() + "_cap", 0, upperBound));
            }
        }
    }

    private static boolean isAllowed(ConnectionType type, ModelType modelType) {
        return switch (type) {
            case WF_EH, EH_ONSS -> modelType.isHubAllowed();
            case WF_ONSS -> modelType.isDirectConnectionAllowed();
            case ONSS_ONSS -> true;
        };
    }

    /**
     * Allocated wind capacity of each country must reach its target, whose value is set for each stage.
     */
    private void createCountryRequirements(NetworkModel model) {
        LinearModel linearModel = model.getLinearModel();
        for (Country country : parameters.getCountries()) {
            LinearConstraint constraint = linearModel.addConstraint("country_req_" + country.name(), ConstraintSense.GREATER_OR_EQUAL, 0);
            for (WindFarm windFarm : model.getNetwork().getWindFarms()) {
                if (parameters.getCrossBorderMode() == CrossBorderMode.POOLED || windFarm.getCountry() == country) {
                    constraint.addTerm(model.getAllocation(windFarm, country), 1);
                }
            }
            model.countryRequirements.put(country, constraint);
        }
    }

    private void createWindFarmConstraints(NetworkModel model) {
        OffshoreNetwork network = model.getNetwork();
        LinearModel linearModel = model.getLinearModel();
        for (WindFarm windFarm : network.getWindFarms()) {
            ModelVariable capacity = model.getWindFarmCapacity(windFarm);

            LinearConstraint allocation = linearModel.addConstraint("wf_alloc_" + windFarm.getId(), ConstraintSense.EQUAL, 0)
                    .addTerm(capacity, -1);
            model.getAllocations(windFarm).values().forEach(v -> allocation.addTerm(v, 1));

            linearModel.addConstraint("wf_rated_" + windFarm.getId(), ConstraintSense.LESS_OR_EQUAL, windFarm.getRatedCapacity())
                    .addTerm(capacity, 1);

            // capacity allocated to a country leaves through cables landing in that country
            List<Connection> toHubs = network.getOutgoingConnections(windFarm, ConnectionType.WF_EH);
            List<Connection> toSubstations = network.getOutgoingConnections(windFarm, ConnectionType.WF_ONSS);
            for (Map.Entry<Country, ModelVariable> e : model.getAllocations(windFarm).entrySet()) {
                Country country = e.getKey();
                LinearConstraint connection = linearModel.addConstraint("wf_conn_" + windFarm.getId() + "_" + country.name(),
                                ConstraintSense.GREATER_OR_EQUAL, 0)
                        .addTerm(e.getValue(), -1);
                addCapacities(model, connection, toHubs, false, country, 1);
                addCapacities(model, connection, toSubstations, false, country, 1);
            }
        }
    }

    private void createHubConstraints(NetworkModel model) {
        OffshoreNetwork network = model.getNetwork();
        LinearModel linearModel = model.getLinearModel();
        for (EnergyHub hub : network.getEnergyHubs()) {
            ModelVariable capacity = model.getHubCapacity(hub);

            LinearConstraint inbound = linearModel.addConstraint("eh_inbound_" + hub.getId(), ConstraintSense.GREATER_OR_EQUAL, 0)
                    .addTerm(capacity, 1);
            for (Connection connection : network.getIncomingConnections(hub, ConnectionType.WF_EH)) {
                inbound.addTerm(model.getConnectionCapacity(connection), -1);
            }

            linearModel.addConstraint("eh_activation_" + hub.getId(), ConstraintSense.LESS_OR_EQUAL, parameters.getZeroThreshold())
                    .addTerm(capacity, 1)
                    .addTerm(model.getHubActivation(hub), -parameters.getHubCapacityLimit());

            LinearConstraint delivery = linearModel.addConstraint("eh_delivery_" + hub.getId(), ConstraintSense.GREATER_OR_EQUAL, 0)
                    .addTerm(capacity, -1);
            addCapacities(model, delivery, network.getOutgoingConnections(hub, ConnectionType.EH_ONSS), false, hub.getCountry(), 1);
        }
    }

    private void createSubstationConstraints(NetworkModel model) {
        OffshoreNetwork network = model.getNetwork();
        LinearModel linearModel = model.getLinearModel();
        for (OnshoreSubstation substation : network.getSubstations()) {
            ModelVariable capacity = model.getSubstationCapacity(substation);

            // incoming offshore capacity plus net transfer from domestic peers
            LinearConstraint balance = linearModel.addConstraint("onss_balance_" + substation.getId(), ConstraintSense.GREATER_OR_EQUAL, 0)
                    .addTerm(capacity, 1);
            for (ConnectionType type : List.of(ConnectionType.EH_ONSS, ConnectionType.WF_ONSS)) {
                for (Connection connection : network.getIncomingConnections(substation, type)) {
                    balance.addTerm(model.getConnectionCapacity(connection), -1);
                }
            }
            addCapacities(model, balance, network.getIncomingConnections(substation, ConnectionType.ONSS_ONSS), true,
                    substation.getCountry(), -1);
            addCapacities(model, balance, network.getOutgoingConnections(substation, ConnectionType.ONSS_ONSS), false,
                    substation.getCountry(), 1);

            // cost coefficients depend on the stage year
            LinearConstraint cost = linearModel.addConstraint("onss_cost_" + substation.getId(), ConstraintSense.GREATER_OR_EQUAL, 0)
                    .addTerm(model.getSubstationCost(substation), 1)
                    .addTerm(capacity, 0);
            model.substationCostConstraints.put(substation, cost);
        }
    }

    /**
     * Add the capacity of the connections whose far end is in the given country.
     */
    private static void addCapacities(NetworkModel model, LinearConstraint constraint, List<Connection> connections,
                                      boolean incoming, Country country, double coefficient) {
        for (Connection connection : connections) {
            OffshoreNode farEnd = incoming ? connection.getSource() : connection.getTarget();
            if (farEnd.getCountry() == country) {
                constraint.addTerm(model.getConnectionCapacity(connection), coefficient);
            }
        }
    }
}
