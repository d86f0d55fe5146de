/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.network;

import com.powsybl.iidm.network.Country;
import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.DirectedMultigraph;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Viable part of the network: nodes having at least one viable cable route and the routes themselves. Connections
 * are oriented in the direction of the power flow (wind farm to hub, hub to substation, wind farm to substation) and
 * peer links between substations exist in both directions.
 *
 * @author Offshore grid planning developers
 */
public class OffshoreNetwork {

    private final Graph<OffshoreNode, Connection> graph = new DirectedMultigraph<>(null, null, false);

    private final List<WindFarm> windFarms;

    private final List<EnergyHub> energyHubs;

    private final List<OnshoreSubstation> substations;

    private final Map<ConnectionType, List<Connection>> connectionsByType = new EnumMap<>(ConnectionType.class);

    public OffshoreNetwork(List<WindFarm> windFarms, List<EnergyHub> energyHubs, List<OnshoreSubstation> substations,
                           List<Connection> connections) {
        this.windFarms = List.copyOf(windFarms);
        this.energyHubs = List.copyOf(energyHubs);
        this.substations = List.copyOf(substations);
        this.windFarms.forEach(graph::addVertex);
        this.energyHubs.forEach(graph::addVertex);
        this.substations.forEach(graph::addVertex);
        for (ConnectionType type : ConnectionType.values()) {
            connectionsByType.put(type, new ArrayList<>());
        }
        for (Connection connection : connections) {
            if (!graph.containsVertex(connection.getSource()) || !graph.containsVertex(connection.getTarget())) {
                throw new IllegalArgumentException("Connection " + connection + " links a node which is not part of the network");
            }
            graph.addEdge(connection.getSource(), connection.getTarget(), connection);
            connectionsByType.get(connection.getType()).add(connection);
        }
    }

    public List<WindFarm> getWindFarms() {
        return windFarms;
    }

    public List<EnergyHub> getEnergyHubs() {
        return energyHubs;
    }

    public List<OnshoreSubstation> getSubstations() {
        return substations;
    }

    public List<Connection> getConnections(ConnectionType type) {
        return Collections.unmodifiableList(connectionsByType.get(Objects.requireNonNull(type)));
    }

    public List<Connection> getConnections() {
        return connectionsByType.values().stream().flatMap(Collection::stream).toList();
    }

    public List<Connection> getOutgoingConnections(OffshoreNode node, ConnectionType type) {
        return filter(graph.outgoingEdgesOf(node), type);
    }

    public List<Connection> getIncomingConnections(OffshoreNode node, ConnectionType type) {
        return filter(graph.incomingEdgesOf(node), type);
    }

    private static List<Connection> filter(Set<Connection> connections, ConnectionType type) {
        return connections.stream().filter(c -> c.getType() == type).toList();
    }

    /**
     * Total rated capacity of the viable wind farms of each country.
     */
    public Map<Country, Double> getRatedCapacityByCountry() {
        return windFarms.stream()
                .collect(Collectors.groupingBy(WindFarm::getCountry, () -> new EnumMap<>(Country.class),
                        Collectors.summingDouble(WindFarm::getRatedCapacity)));
    }

    public int getComponentCount() {
        return new ConnectivityInspector<>(graph).connectedSets().size();
    }
}
