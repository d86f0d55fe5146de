/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.config.InMemoryPlatformConfig;
import com.powsybl.commons.config.MapModuleConfig;
import com.powsybl.iidm.network.Country;
import com.powsybl.offshoregrid.model.NetworkModelParameters;
import com.powsybl.offshoregrid.model.StageParameters;
import com.powsybl.offshoregrid.network.AssetClass;
import com.powsybl.offshoregrid.network.ConnectionType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Offshore grid planning developers
 */
class OffshoreGridParametersTest {

    private FileSystem fileSystem;

    private InMemoryPlatformConfig platformConfig;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        platformConfig = new InMemoryPlatformConfig(fileSystem);
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testDefaultValues() {
        OffshoreGridParameters parameters = OffshoreGridParameters.load(platformConfig);
        assertEquals(ModelType.POINT_TO_POINT, parameters.getModelType());
        assertEquals(CrossBorderMode.POOLED, parameters.getCrossBorderMode());
        assertEquals(PlanningMode.SINGLE_YEAR, parameters.getPlanningMode());
        assertEquals(CableCountMode.DISCRETE, parameters.getCableCountMode());
        assertEquals(StageFailurePolicy.HALT, parameters.getStageFailurePolicy());
        assertEquals("ojalgo", parameters.getSolverName());
        assertEquals(15, parameters.getTurbineCapacity(), 0);
        assertEquals(2040, parameters.getSingleYear());
        assertEquals(List.of(2030, 2040, 2050), parameters.getMultiYears());
        assertEquals(8, parameters.getCountryCapacityFractions().size());
        assertEquals(0.0563, parameters.getCountryCapacityFractions().get(Country.DK), 0);
        assertEquals(500, parameters.getConnectionThresholds().get(ConnectionType.WF_ONSS), 0);
        assertEquals("r_sf_d_in", parameters.getFilePrefix());
        assertEquals(Set.of(2040), parameters.getCostYears());
    }

    @Test
    void testConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(OffshoreGridParameters.MODULE_NAME);
        moduleConfig.setStringProperty("modelType", "HUB_AND_SPOKE");
        moduleConfig.setStringProperty("crossBorderMode", "DOMESTIC");
        moduleConfig.setStringProperty("planningMode", "MULTI_YEAR");
        moduleConfig.setStringProperty("stageFailurePolicy", "CONTINUE_WITH_LAST_BOUNDS");
        moduleConfig.setStringProperty("wfEhMaxDistance", "150");
        moduleConfig.setStringProperty("multiYears", "2035,2045");
        moduleConfig.setStringProperty("developmentFractions", "0.5,1.0");
        moduleConfig.setStringProperty("countryCapacityFractions", "DE=0.8,PL=0.4");
        moduleConfig.setStringProperty("discountRate", "0.07");
        moduleConfig.setStringProperty("costSensitivityFactors", "ENERGY_HUB=1.5");

        OffshoreGridParameters parameters = OffshoreGridParameters.load(platformConfig);
        assertEquals(ModelType.HUB_AND_SPOKE, parameters.getModelType());
        assertEquals(CrossBorderMode.DOMESTIC, parameters.getCrossBorderMode());
        assertEquals(PlanningMode.MULTI_YEAR, parameters.getPlanningMode());
        assertEquals(StageFailurePolicy.CONTINUE_WITH_LAST_BOUNDS, parameters.getStageFailurePolicy());
        assertEquals(150, parameters.getConnectionThresholds().get(ConnectionType.WF_EH), 0);
        assertEquals(List.of(2035, 2045), parameters.getMultiYears());
        assertEquals(Map.of(Country.DE, 0.8, Country.PL, 0.4), parameters.getCountryCapacityFractions());
        assertEquals(0.07, parameters.getCostParameters().getDiscountRate(), 0);
        assertEquals(1.5, parameters.getCostParameters().getSensitivityFactor(AssetClass.ENERGY_HUB), 0);
        assertEquals(1.0, parameters.getCostParameters().getSensitivityFactor(AssetClass.WIND_FARM), 0);
        assertEquals("r_mf_hs_n", parameters.getFilePrefix());
        assertEquals(Set.of(2035, 2040, 2045), parameters.getCostYears());
    }

    @Test
    void testInvalidConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(OffshoreGridParameters.MODULE_NAME);
        moduleConfig.setStringProperty("modelType", "RADIAL");
        assertThrows(IllegalArgumentException.class, () -> OffshoreGridParameters.load(platformConfig));
    }

    @Test
    void testUpdate() {
        OffshoreGridParameters parameters = OffshoreGridParameters.load(Map.of(
                "modelType", "COMBINED",
                "cableCountMode", "CONTINUOUS",
                "countryCapacityFractions", "DE=0.5,DK=0.25",
                "hubCapacityLimit", "2000"));
        assertEquals(ModelType.COMBINED, parameters.getModelType());
        assertEquals(CableCountMode.CONTINUOUS, parameters.getCableCountMode());
        assertEquals(Map.of(Country.DE, 0.5, Country.DK, 0.25), parameters.getCountryCapacityFractions());

        NetworkModelParameters modelParameters = parameters.createNetworkModelParameters();
        assertEquals(ModelType.COMBINED, modelParameters.getModelType());
        assertEquals(2000, modelParameters.getHubCapacityLimit(), 0);
        assertEquals(List.of(Country.DE, Country.DK), modelParameters.getCountries());

        parameters.update(Map.of("singleYear", "2030"));
        assertEquals(2030, parameters.getSingleYear());
        assertEquals(ModelType.COMBINED, parameters.getModelType());

        assertThrows(IllegalArgumentException.class, () -> parameters.update(Map.of("countryCapacityFractions", "DE")));
        assertThrows(IllegalArgumentException.class, () -> parameters.update(Map.of("countryCapacityFractions", "DE=1.5")));
        assertThrows(IllegalArgumentException.class, () -> parameters.update(Map.of("multiYears", "2040,2030")));
        assertThrows(IllegalArgumentException.class, () -> parameters.update(Map.of("turbineCapacity", "0")));
    }

    @Test
    void testSingleStage() {
        OffshoreGridParameters parameters = new OffshoreGridParameters()
                .setCountryCapacityFractions(Map.of(Country.DE, 0.5));
        List<StageParameters> stages = parameters.createStages();
        assertEquals(1, stages.size());
        assertEquals(2040, stages.get(0).getYear());
        assertEquals(0.5, stages.get(0).getCountryFraction(Country.DE), 0);
    }

    @Test
    void testMultiStages() {
        OffshoreGridParameters parameters = new OffshoreGridParameters()
                .setPlanningMode(PlanningMode.MULTI_YEAR)
                .setCountryCapacityFractions(Map.of(Country.DE, 1.0, Country.SE, 0.5));
        List<StageParameters> stages = parameters.createStages();
        assertEquals(List.of(2030, 2040, 2050), stages.stream().map(StageParameters::getYear).toList());
        assertEquals(0.3056, stages.get(0).getCountryFraction(Country.DE), 1e-12);
        assertEquals(0.7115 * 0.5, stages.get(1).getCountryFraction(Country.SE), 1e-12);
        assertEquals(1.0, stages.get(2).getCountryFraction(Country.DE), 0);
        assertEquals(Set.of(2030, 2040, 2050), parameters.getCostYears());

        parameters.setDevelopmentFractions(List.of(0.5, 1.0));
        assertThrows(IllegalArgumentException.class, parameters::createStages);
    }

    @Test
    void testNote() {
        OffshoreGridParameters parameters = new OffshoreGridParameters().setModelType(ModelType.COMBINED);
        assertTrue(parameters.getNote().contains("modelType=COMBINED"));
        assertTrue(parameters.toString().startsWith("OffshoreGridParameters(modelType=COMBINED"));
    }
}
