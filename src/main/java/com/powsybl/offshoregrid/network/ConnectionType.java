/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.network;

/**
 * The four cable classes of the network.
 *
 * @author Offshore grid planning developers
 */
public enum ConnectionType {
    WF_EH("ec1", NodeType.WIND_FARM, NodeType.ENERGY_HUB),
    EH_ONSS("ec2", NodeType.ENERGY_HUB, NodeType.ONSHORE_SUBSTATION),
    WF_ONSS("ec3", NodeType.WIND_FARM, NodeType.ONSHORE_SUBSTATION),
    ONSS_ONSS("onc", NodeType.ONSHORE_SUBSTATION, NodeType.ONSHORE_SUBSTATION);

    private final String code;

    private final NodeType sourceType;

    private final NodeType targetType;

    ConnectionType(String code, NodeType sourceType, NodeType targetType) {
        this.code = code;
        this.sourceType = sourceType;
        this.targetType = targetType;
    }

    public String getCode() {
        return code;
    }

    public NodeType getSourceType() {
        return sourceType;
    }

    public NodeType getTargetType() {
        return targetType;
    }
}
