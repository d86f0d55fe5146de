/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.cost;

import com.powsybl.offshoregrid.network.ConnectionType;

import java.util.Objects;

/**
 * Cable route characteristics of each connection class.
 *
 * @author Offshore grid planning developers
 */
public enum CableType {
    WF_EH_EXPORT(0, CableCostModel.INSTALLATION_COST),
    EH_ONSS_EXPORT(2, CableCostModel.INSTALLATION_COST),
    WF_ONSS_EXPORT(2, CableCostModel.INSTALLATION_COST),
    ONSHORE(0, CableCostModel.INSTALLATION_COST * 0.5);

    private final double transitionLength;

    private final double installationCost;

    CableType(double transitionLength, double installationCost) {
        this.transitionLength = transitionLength;
        this.installationCost = installationCost;
    }

    /**
     * Extra length in km for the landfall.
     */
    public double getTransitionLength() {
        return transitionLength;
    }

    /**
     * Installation cost in M€/km.
     */
    public double getInstallationCost() {
        return installationCost;
    }

    public static CableType of(ConnectionType connectionType) {
        Objects.requireNonNull(connectionType);
        return switch (connectionType) {
            case WF_EH -> WF_EH_EXPORT;
            case EH_ONSS -> EH_ONSS_EXPORT;
            case WF_ONSS -> WF_ONSS_EXPORT;
            case ONSS_ONSS -> ONSHORE;
        };
    }
}
