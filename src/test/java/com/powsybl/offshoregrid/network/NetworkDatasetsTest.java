/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.network;

import com.powsybl.iidm.network.Country;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Offshore grid planning developers
 */
class NetworkDatasetsTest {

    @Test
    void testValid() {
        NetworkDatasets datasets = OffshoreDatasetsFactory.createSimple();
        assertDoesNotThrow(() -> datasets.validate(List.of(2030, 2040, 2050)));
        assertEquals(List.of(1, 2), List.copyOf(datasets.getWindFarms().keySet()));
        assertEquals(1, datasets.getEnergyHubs().size());
        assertEquals(1, datasets.getSubstations().size());
    }

    @Test
    void testDuplicateId() {
        List<WindFarm> windFarms = List.of(new WindFarm(1, Country.DE, 6, 54, 100, Map.of(2040, 1.0)),
                new WindFarm(1, Country.DK, 7, 55, 100, Map.of(2040, 1.0)));
        InputDataException e = assertThrows(InputDataException.class, () -> new NetworkDatasets(windFarms, List.of(), List.of()));
        assertEquals("Duplicate wind farm id 1", e.getMessage());
    }

    @Test
    void testSameIdInDifferentClasses() {
        NetworkDatasets datasets = new NetworkDatasets(List.of(new WindFarm(1, Country.DE, 6, 54, 100, Map.of(2040, 1.0))),
                List.of(new EnergyHub(1, Country.DE, 6.5, 54, 20, false, 1000)),
                List.of(new OnshoreSubstation(1, Country.DE, 7, 53.5, 100)));
        assertDoesNotThrow(() -> datasets.validate(List.of(2040)));
    }

    @Test
    void testMissingCost() {
        NetworkDatasets datasets = OffshoreDatasetsFactory.createSimple();
        InputDataException e = assertThrows(InputDataException.class, () -> datasets.validate(List.of(2040, 2045)));
        assertTrue(e.getMessage().contains("wf_1: missing cost for year 2045"));
        assertTrue(e.getMessage().contains("wf_2: missing cost for year 2045"));
    }

    @Test
    void testAllErrorsReported() {
        NetworkDatasets datasets = new NetworkDatasets(
                List.of(new WindFarm(1, Country.DE, 200, 54, 0, Map.of(2040, -1.0))),
                List.of(new EnergyHub(2, Country.DE, 6.5, Double.NaN, -20, false, 1000)),
                List.of(new OnshoreSubstation(3, null, 7, 53.5, -100)));
        InputDataException e = assertThrows(InputDataException.class, () -> datasets.validate(List.of(2040)));
        String message = e.getMessage();
        assertTrue(message.contains("wf_1: invalid longitude 200.0"));
        assertTrue(message.contains("wf_1: rated capacity must be positive"));
        assertTrue(message.contains("wf_1: cost 2040 must be non negative"));
        assertTrue(message.contains("eh_2: invalid latitude NaN"));
        assertTrue(message.contains("eh_2: water depth must be non negative"));
        assertTrue(message.contains("onss_3: missing country"));
        assertTrue(message.contains("onss_3: capacity threshold must be non negative"));
    }

    @Test
    void testInvalidConnection() {
        WindFarm windFarm = new WindFarm(1, Country.DE, 6, 54, 100, Map.of(2040, 1.0));
        OnshoreSubstation substation = new OnshoreSubstation(1, Country.DE, 7, 53.5, 100);
        assertThrows(IllegalArgumentException.class, () -> new Connection(ConnectionType.WF_EH, windFarm, substation, 10));
        assertThrows(IllegalArgumentException.class, () -> new OffshoreNetwork(List.of(windFarm), List.of(), List.of(),
                List.of(new Connection(ConnectionType.WF_ONSS, windFarm, substation, 10))));
    }

    @Test
    void testNetworkQueries() {
        WindFarm wf1 = new WindFarm(1, Country.DE, 6, 54, 100, Map.of(2040, 1.0));
        WindFarm wf2 = new WindFarm(2, Country.DE, 6.1, 54, 50, Map.of(2040, 1.0));
        WindFarm wf3 = new WindFarm(3, Country.DK, 7, 55, 70, Map.of(2040, 1.0));
        EnergyHub hub = new EnergyHub(1, Country.DE, 6.5, 54, 20, false, 1000);
        OnshoreSubstation substation = new OnshoreSubstation(1, Country.DE, 7, 53.5, 100);
        Connection c1 = new Connection(ConnectionType.WF_EH, wf1, hub, 10);
        Connection c2 = new Connection(ConnectionType.WF_EH, wf2, hub, 12);
        Connection c3 = new Connection(ConnectionType.WF_ONSS, wf1, substation, 50);
        Connection c4 = new Connection(ConnectionType.EH_ONSS, hub, substation, 40);
        OffshoreNetwork network = new OffshoreNetwork(List.of(wf1, wf2, wf3), List.of(hub), List.of(substation),
                List.of(c1, c2, c3, c4));

        assertEquals(List.of(c1, c2), network.getIncomingConnections(hub, ConnectionType.WF_EH));
        assertEquals(List.of(c4), network.getOutgoingConnections(hub, ConnectionType.EH_ONSS));
        assertEquals(List.of(c3), network.getOutgoingConnections(wf1, ConnectionType.WF_ONSS));
        assertTrue(network.getIncomingConnections(substation, ConnectionType.ONSS_ONSS).isEmpty());
        assertEquals(4, network.getConnections().size());
        assertEquals(Map.of(Country.DE, 150.0, Country.DK, 70.0), network.getRatedCapacityByCountry());
        // the Danish wind farm is isolated
        assertEquals(2, network.getComponentCount());
    }
}
