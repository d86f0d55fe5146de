/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.geo;

import com.powsybl.offshoregrid.network.ConnectionType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maximum cable route length per connection class, in km.
 *
 * @author Offshore grid planning developers
 */
public class ConnectionThresholds {

    public static final double WF_EH_DEFAULT_VALUE = 250;
    public static final double EH_ONSS_DEFAULT_VALUE = 250;
    public static final double WF_ONSS_DEFAULT_VALUE = 500;
    public static final double ONSS_ONSS_DEFAULT_VALUE = 250;

    private final Map<ConnectionType, Double> thresholds = new EnumMap<>(ConnectionType.class);

    public ConnectionThresholds() {
        thresholds.put(ConnectionType.WF_EH, WF_EH_DEFAULT_VALUE);
        thresholds.put(ConnectionType.EH_ONSS, EH_ONSS_DEFAULT_VALUE);
        thresholds.put(ConnectionType.WF_ONSS, WF_ONSS_DEFAULT_VALUE);
        thresholds.put(ConnectionType.ONSS_ONSS, ONSS_ONSS_DEFAULT_VALUE);
    }

    public double get(ConnectionType type) {
        return thresholds.get(Objects.requireNonNull(type));
    }

    public ConnectionThresholds set(ConnectionType type, double threshold) {
        Objects.requireNonNull(type);
        if (!(threshold >= 0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("Invalid distance threshold for " + type + ": " + threshold);
        }
        thresholds.put(type, threshold);
        return this;
    }

    @Override
    public String toString() {
        return thresholds.toString();
    }
}
