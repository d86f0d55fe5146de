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
 * Asset classes for which costs and results are reported.
 *
 * @author Offshore grid planning developers
 */
public enum AssetClass {
    WIND_FARM("wf"),
    ENERGY_HUB("eh"),
    ONSHORE_SUBSTATION("onss"),
    WF_EH_CABLE("ec1"),
    EH_ONSS_CABLE("ec2"),
    WF_ONSS_CABLE("ec3"),
    ONSHORE_CABLE("onc");

    private final String code;

    AssetClass(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static AssetClass of(NodeType nodeType) {
        Objects.requireNonNull(nodeType);
        return switch (nodeType) {
            case WIND_FARM -> WIND_FARM;
            case ENERGY_HUB -> ENERGY_HUB;
            case ONSHORE_SUBSTATION -> ONSHORE_SUBSTATION;
        };
    }

    public static AssetClass of(ConnectionType connectionType) {
        Objects.requireNonNull(connectionType);
        return switch (connectionType) {
            case WF_EH -> WF_EH_CABLE;
            case EH_ONSS -> EH_ONSS_CABLE;
            case WF_ONSS -> WF_ONSS_CABLE;
            case ONSS_ONSS -> ONSHORE_CABLE;
        };
    }
}
