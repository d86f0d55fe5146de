/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.network;

import java.util.Objects;

/**
 * A viable cable route between two nodes. Connections are compared by identity, so that the same pair of nodes
 * can be linked in both directions.
 *
 * @author Offshore grid planning developers
 */
public class Connection {

    private final ConnectionType type;

    private final OffshoreNode source;

    private final OffshoreNode target;

    private final double distance;

    public Connection(ConnectionType type, OffshoreNode source, OffshoreNode target, double distance) {
        this.type = Objects.requireNonNull(type);
        this.source = Objects.requireNonNull(source);
        this.target = Objects.requireNonNull(target);
        if (source.getType() != type.getSourceType() || target.getType() != type.getTargetType()) {
            throw new IllegalArgumentException("Connection " + type + " cannot link " + source + " to " + target);
        }
        this.distance = distance;
    }

    public ConnectionType getType() {
        return type;
    }

    public OffshoreNode getSource() {
        return source;
    }

    public OffshoreNode getTarget() {
        return target;
    }

    /**
     * Great-circle distance between both ends in km.
     */
    public double getDistance() {
        return distance;
    }

    public String getName() {
        return type.getCode() + "_" + source.getId() + "_" + target.getId();
    }

    @Override
    public String toString() {
        return getName();
    }
}
