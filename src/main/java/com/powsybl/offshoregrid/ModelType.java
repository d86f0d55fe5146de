/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid;

/**
 * Network topology variant.
 *
 * @author Offshore grid planning developers
 */
public enum ModelType {
    /**
     * Wind farms are connected directly to onshore substations only.
     */
    POINT_TO_POINT("d"),
    /**
     * Wind farms are connected through energy hubs only.
     */
    HUB_AND_SPOKE("hs"),
    /**
     * Both direct and hub connections are allowed.
     */
    COMBINED("c");

    private final String code;

    ModelType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isHubAllowed() {
        return this != POINT_TO_POINT;
    }

    public boolean isDirectConnectionAllowed() {
        return this != HUB_AND_SPOKE;
    }
}
