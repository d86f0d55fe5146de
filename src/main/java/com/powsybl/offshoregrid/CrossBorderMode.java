/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid;

/**
 * @author Offshore grid planning developers
 */
public enum CrossBorderMode {
    /**
     * Connections must stay within one country and a country target is met by its own wind farms only.
     */
    DOMESTIC("n"),
    /**
     * Any wind farm may contribute to any country target.
     */
    POOLED("in");

    private final String code;

    CrossBorderMode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
