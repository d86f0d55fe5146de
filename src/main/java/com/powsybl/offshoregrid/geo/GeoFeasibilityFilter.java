/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.geo;

import com.powsybl.offshoregrid.CrossBorderMode;
import com.powsybl.offshoregrid.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Keeps the cable routes whose length does not exceed the threshold of their class and the nodes that can be
 * connected through them.
 *
 * @author Offshore grid planning developers
 */
public class GeoFeasibilityFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeoFeasibilityFilter.class);

    private final ConnectionThresholds thresholds;

    private final CrossBorderMode crossBorderMode;

    public GeoFeasibilityFilter(ConnectionThresholds thresholds, CrossBorderMode crossBorderMode) {
        this.thresholds = Objects.requireNonNull(thresholds);
        this.crossBorderMode = Objects.requireNonNull(crossBorderMode);
    }

    /**
     * All viable pairs of a class, in ascending source then target id order.
     */
    public List<Connection> findViableConnections(ConnectionType type, Collection<? extends OffshoreNode> sources,
                                                  Collection<? extends OffshoreNode> targets) {
        Objects.requireNonNull(type);
        double threshold = thresholds.get(type);
        List<Connection> connections = new ArrayList<>();
        for (OffshoreNode source : sortById(sources)) {
            for (OffshoreNode target : sortById(targets)) {
                if (type == ConnectionType.ONSS_ONSS && source.getId() == target.getId()) {
                    continue;
                }
                if (crossBorderMode == CrossBorderMode.DOMESTIC && source.getCountry() != target.getCountry()) {
                    continue;
                }
                double distance = GeoDistance.distance(source, target);
                if (distance <= threshold) {
                    connections.add(new Connection(type, source, target, distance));
                }
            }
        }
        return connections;
    }

    private static List<OffshoreNode> sortById(Collection<? extends OffshoreNode> nodes) {
        List<OffshoreNode> sorted = new ArrayList<>(nodes);
        sorted.sort(Comparator.comparingInt(OffshoreNode::getId));
        return sorted;
    }

    public OffshoreNetwork filter(NetworkDatasets datasets) {
        Objects.requireNonNull(datasets);
        Collection<WindFarm> windFarms = datasets.getWindFarms().values();
        Collection<EnergyHub> hubs = datasets.getEnergyHubs().values();
        Collection<OnshoreSubstation> substations = datasets.getSubstations().values();

        List<Connection> wfEh = findViableConnections(ConnectionType.WF_EH, windFarms, hubs);
        List<Connection> ehOnss = findViableConnections(ConnectionType.EH_ONSS, hubs, substations);
        List<Connection> wfOnss = findViableConnections(ConnectionType.WF_ONSS, windFarms, substations);

        // peer links do not make a substation viable
        Set<OffshoreNode> viable = new HashSet<>();
        for (List<Connection> connections : List.of(wfEh, ehOnss, wfOnss)) {
            for (Connection connection : connections) {
                viable.add(connection.getSource());
                viable.add(connection.getTarget());
            }
        }
        List<WindFarm> viableWindFarms = windFarms.stream().filter(viable::contains).toList();
        List<EnergyHub> viableHubs = hubs.stream().filter(viable::contains).toList();
        List<OnshoreSubstation> viableSubstations = substations.stream().filter(viable::contains).toList();

        List<Connection> onssOnss = findViableConnections(ConnectionType.ONSS_ONSS, viableSubstations, viableSubstations);

        List<Connection> connections = new ArrayList<>(wfEh.size() + ehOnss.size() + wfOnss.size() + onssOnss.size());
        connections.addAll(wfEh);
        connections.addAll(ehOnss);
        connections.addAll(wfOnss);
        connections.addAll(onssOnss);

        LOGGER.info("Viable network: {}/{} wind farms, {}/{} energy hubs, {}/{} onshore substations",
                viableWindFarms.size(), windFarms.size(), viableHubs.size(), hubs.size(),
                viableSubstations.size(), substations.size());
        LOGGER.info("Viable connections: {} WF-EH, {} EH-ONSS, {} WF-ONSS, {} ONSS-ONSS ({})",
                wfEh.size(), ehOnss.size(), wfOnss.size(), onssOnss.size(), crossBorderMode);

        OffshoreNetwork network = new OffshoreNetwork(viableWindFarms, viableHubs, viableSubstations, connections);
        LOGGER.debug("Viable network has {} connected components", network.getComponentCount());
        return network;
    }
}
