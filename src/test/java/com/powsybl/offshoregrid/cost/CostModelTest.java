/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.cost;

import com.powsybl.iidm.network.Country;
import com.powsybl.offshoregrid.CableCountMode;
import com.powsybl.offshoregrid.network.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Offshore grid planning developers
 */
class CostModelTest {

    private static final int[] YEARS = {2030, 2040, 2050};

    private final WindFarm windFarm = new WindFarm(1, Country.DE, 6.0, 54.5, 100, OffshoreDatasetsFactory.costs(300, 250, 200));

    private final EnergyHub shallowHub = new EnergyHub(1, Country.DE, 6.5, 54.3, 20, false, 50000);

    private final EnergyHub deepHub = new EnergyHub(2, Country.FI, 21.0, 62.0, 80, true, 120000);

    private final OnshoreSubstation substation = new OnshoreSubstation(1, Country.DE, 7.0, 53.6, 500);

    private final Connection cable = new Connection(ConnectionType.WF_ONSS, windFarm, substation, 120);

    @Test
    void testZeroAtZeroCapacity() {
        CostModel costModel = new CostModel(new CostParameters());
        for (int year : YEARS) {
            assertEquals(0, costModel.windFarmCost(windFarm, year, 0), 0);
            assertEquals(0, costModel.energyHubCost(shallowHub, year, 0, false), 0);
            assertEquals(0, costModel.substationCost(substation, year, 0), 0);
            assertEquals(0, costModel.cableCost(cable, year, 0, CableCountMode.DISCRETE), 0);
            assertEquals(0, costModel.cableCost(cable, year, 0, CableCountMode.CONTINUOUS), 0);
        }
    }

    @Test
    void testNonNegative() {
        CostModel costModel = new CostModel(new CostParameters());
        for (int year : YEARS) {
            for (EnergyHub hub : new EnergyHub[] {shallowHub, deepHub}) {
                LinearCost cost = costModel.energyHub(hub, year);
                assertTrue(cost.perUnit() > 0);
                assertTrue(cost.fixed() > 0);
                assertTrue(costModel.energyHubCost(hub, year, 500, true) > costModel.energyHubCost(hub, year, 500, false));
            }
            for (ConnectionType type : new ConnectionType[] {ConnectionType.WF_EH, ConnectionType.WF_ONSS}) {
                OffshoreNode target = type == ConnectionType.WF_EH ? shallowHub : substation;
                LinearCost cost = costModel.cable(new Connection(type, windFarm, target, 50), year);
                assertTrue(cost.perUnit() > 0);
                assertEquals(0, cost.fixed(), 0);
            }
            assertTrue(costModel.substationRate(year) > 0);
            assertTrue(costModel.windFarm(windFarm, year).perUnit() > 0);
        }
    }

    @Test
    void testWindFarmCost() {
        CostModel costModel = new CostModel(new CostParameters());
        assertEquals(2.5, costModel.windFarm(windFarm, 2040).perUnit(), 1e-12);
        assertEquals(250, costModel.windFarmCost(windFarm, 2040, 100), 1e-9);
        assertEquals(150, costModel.windFarmCost(windFarm, 2030, 50), 1e-9);
        assertThrows(InputDataException.class, () -> costModel.windFarmCost(windFarm, 2045, 10));
    }

    @Test
    void testSubstationCostAboveThreshold() {
        CostModel costModel = new CostModel(new CostParameters());
        assertEquals(0, costModel.substationCost(substation, 2030, 500), 0);
        double rate = costModel.substationRate(2030);
        assertEquals(100 * rate, costModel.substationCost(substation, 2030, 600), 1e-12);
        PresentValue presentValue = new PresentValue(new CostParameters());
        assertEquals(presentValue.of(2030, SubstationCostModel.EQUIPMENT_COST, 0,
                SubstationCostModel.OPERATION_RATE * SubstationCostModel.EQUIPMENT_COST, 0), rate, 1e-12);
    }

    @Test
    void testCableCount() {
        double unit = CableCostModel.CABLE_CAPACITY * CableCostModel.POWER_FACTOR;
        assertEquals(0, CableCostModel.cableCount(0, CableCountMode.DISCRETE), 0);
        assertEquals(1, CableCostModel.cableCount(unit, CableCountMode.DISCRETE), 0);
        assertEquals(2, CableCostModel.cableCount(unit + 0.01, CableCountMode.DISCRETE), 0);
        assertEquals(1, CableCostModel.cableCount(1, CableCountMode.DISCRETE), 0);
        assertEquals(0.5, CableCostModel.cableCount(unit / 2, CableCountMode.CONTINUOUS), 1e-12);
        assertEquals(0, CableCostModel.cableCount(-10, CableCountMode.CONTINUOUS), 0);
    }

    @Test
    void testDiscreteCableCostIsStepwise() {
        CostModel costModel = new CostModel(new CostParameters());
        double oneCable = costModel.cableCost(cable, 2040, 1, CableCountMode.DISCRETE);
        assertEquals(oneCable, costModel.cableCost(cable, 2040, 300, CableCountMode.DISCRETE), 1e-9);
        assertEquals(2 * oneCable, costModel.cableCost(cable, 2040, 400, CableCountMode.DISCRETE), 1e-9);
        double unit = CableCostModel.CABLE_CAPACITY * CableCostModel.POWER_FACTOR;
        assertEquals(oneCable, costModel.cable(cable, 2040).perUnit() * unit, 1e-9);
    }

    @Test
    void testCableLength() {
        assertEquals(110, CableCostModel.length(CableType.WF_EH_EXPORT, 100), 1e-9);
        assertEquals(112, CableCostModel.length(CableType.WF_ONSS_EXPORT, 100), 1e-9);
        assertEquals(CableType.ONSHORE, CableType.of(ConnectionType.ONSS_ONSS));
        assertTrue(CableType.ONSHORE.getInstallationCost() < CableType.EH_ONSS_EXPORT.getInstallationCost());
    }

    @Test
    void testSupportStructure() {
        assertEquals(SupportStructure.MONOPILE, SupportStructure.of(0));
        assertEquals(SupportStructure.MONOPILE, SupportStructure.of(24.99));
        assertEquals(SupportStructure.JACKET, SupportStructure.of(25));
        assertEquals(SupportStructure.JACKET, SupportStructure.of(54.99));
        assertEquals(SupportStructure.FLOATING, SupportStructure.of(55));
    }

    @Test
    void testHubYearLookup() {
        assertEquals(EnergyHubCostModel.converterCost(shallowHub, 2030), EnergyHubCostModel.converterCost(shallowHub, 2035), 0);
        assertEquals(EnergyHubCostModel.converterCost(shallowHub, 2030), EnergyHubCostModel.converterCost(shallowHub, 2025), 0);
        assertEquals(EnergyHubCostModel.converterCost(shallowHub, 2050), EnergyHubCostModel.converterCost(shallowHub, 2060), 0);
        assertTrue(EnergyHubCostModel.converterCost(shallowHub, 2040) < EnergyHubCostModel.converterCost(shallowHub, 2030));
    }

    @Test
    void testIceCover() {
        EnergyHub icy = new EnergyHub(3, Country.DE, 6.5, 54.3, 20, true, 50000);
        assertEquals(EnergyHubCostModel.ICE_COVER_FACTOR * EnergyHubCostModel.converterCost(shallowHub, 2040),
                EnergyHubCostModel.converterCost(icy, 2040), 1e-12);
        CostModel costModel = new CostModel(new CostParameters());
        assertTrue(costModel.energyHub(icy, 2040).perUnit() > costModel.energyHub(shallowHub, 2040).perUnit());
    }

    @Test
    void testVesselCostGrowsWithPortDistance() {
        EnergyHub farFromPort = new EnergyHub(3, Country.DE, 6.5, 54.3, 20, false, 300000);
        assertTrue(EnergyHubCostModel.vesselCost(farFromPort, true) > EnergyHubCostModel.vesselCost(shallowHub, true));
        // floating platforms use tugs and anchor handling vessels
        assertTrue(EnergyHubCostModel.vesselCost(deepHub, true) > EnergyHubCostModel.vesselCost(deepHub, false));
    }

    @Test
    void testSensitivityFactors() {
        CostModel reference = new CostModel(new CostParameters());
        CostModel scaled = new CostModel(new CostParameters()
                .setSensitivityFactor(AssetClass.ENERGY_HUB, 2)
                .setSensitivityFactor(AssetClass.WF_ONSS_CABLE, 0.5)
                .setSensitivityFactor(AssetClass.ONSHORE_SUBSTATION, 0));
        assertEquals(2 * reference.energyHub(shallowHub, 2040).perUnit(), scaled.energyHub(shallowHub, 2040).perUnit(), 1e-12);
        assertEquals(2 * reference.energyHub(shallowHub, 2040).fixed(), scaled.energyHub(shallowHub, 2040).fixed(), 1e-12);
        assertEquals(0.5 * reference.cableCost(cable, 2040, 500, CableCountMode.DISCRETE),
                scaled.cableCost(cable, 2040, 500, CableCountMode.DISCRETE), 1e-9);
        assertEquals(0, scaled.substationCost(substation, 2040, 1000), 0);
        assertEquals(reference.windFarm(windFarm, 2040), scaled.windFarm(windFarm, 2040));
    }

    @Test
    void testLinearCost() {
        LinearCost cost = new LinearCost(2, 10);
        assertEquals(10, cost.evaluate(0, true), 0);
        assertEquals(0, cost.evaluate(-5, false), 0);
        assertEquals(30, cost.evaluate(10, true), 0);
        assertEquals(new LinearCost(1, 5), cost.scale(0.5));
        assertEquals(0, LinearCost.ZERO.evaluate(100, true), 0);
    }
}
