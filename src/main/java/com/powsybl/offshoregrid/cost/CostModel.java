/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.cost;

import com.powsybl.offshoregrid.CableCountMode;
import com.powsybl.offshoregrid.network.*;

import java.util.Objects;

/**
 * Cost of every asset class in M€, present-valued and scaled by the class sensitivity factor.
 *
 * @author Offshore grid planning developers
 */
public class CostModel {

    private final CostParameters parameters;

    private final EnergyHubCostModel energyHubCostModel;

    private final CableCostModel cableCostModel;

    private final SubstationCostModel substationCostModel;

    public CostModel(CostParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
        PresentValue presentValue = new PresentValue(parameters);
        energyHubCostModel = new EnergyHubCostModel(presentValue);
        cableCostModel = new CableCostModel(presentValue);
        substationCostModel = new SubstationCostModel(presentValue);
    }

    public CostParameters getParameters() {
        return parameters;
    }

    private double factor(AssetClass assetClass) {
        return parameters.getSensitivityFactor(assetClass);
    }

    public LinearCost windFarm(WindFarm windFarm, int year) {
        return WindFarmCostModel.linear(windFarm, year).scale(factor(AssetClass.WIND_FARM));
    }

    public double windFarmCost(WindFarm windFarm, int year, double capacity) {
        return windFarm(windFarm, year).evaluate(capacity, false);
    }

    public LinearCost energyHub(EnergyHub hub, int year) {
        return energyHubCostModel.linear(hub, year).scale(factor(AssetClass.ENERGY_HUB));
    }

    public double energyHubCost(EnergyHub hub, int year, double capacity, boolean built) {
        return energyHub(hub, year).evaluate(capacity, built);
    }

    public LinearCost cable(Connection connection, int year) {
        return cableCostModel.linear(CableType.of(connection.getType()), connection.getDistance(), year)
                .scale(factor(AssetClass.of(connection.getType())));
    }

    public double cableCost(Connection connection, int year, double capacity, CableCountMode mode) {
        return cableCostModel.cost(CableType.of(connection.getType()), connection.getDistance(), year, capacity, mode)
                * factor(AssetClass.of(connection.getType()));
    }

    /**
     * Cost per MW of substation capacity above the threshold.
     */
    public double substationRate(int year) {
        return substationCostModel.rate(year) * factor(AssetClass.ONSHORE_SUBSTATION);
    }

    public double substationCost(OnshoreSubstation substation, int year, double capacity) {
        return substationCostModel.cost(substation, year, capacity) * factor(AssetClass.ONSHORE_SUBSTATION);
    }
}
