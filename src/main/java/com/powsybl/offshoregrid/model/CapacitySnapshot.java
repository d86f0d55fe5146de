/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Realized capacities of a solved stage, rounded to integer MW, used as lower bounds of the next stage.
 *
 * @author Offshore grid planning developers
 */
public final class CapacitySnapshot {

    public static final CapacitySnapshot EMPTY = new CapacitySnapshot(Collections.emptyMap());

    private final Map<String, Double> capacities;

    private CapacitySnapshot(Map<String, Double> capacities) {
        this.capacities = Collections.unmodifiableMap(capacities);
    }

    /**
     * Values not above the zero threshold are left out. Others are rounded half to even.
     */
    public static CapacitySnapshot of(List<ModelVariable> variables, double[] values, double zeroThreshold) {
        Objects.requireNonNull(variables);
        Objects.requireNonNull(values);
        Map<String, Double> capacities = new LinkedHashMap<>();
        for (ModelVariable variable : variables) {
            double value = values[variable.getIndex()];
            if (value > zeroThreshold) {
                capacities.put(variable.getName(), Math.rint(value));
            }
        }
        return new CapacitySnapshot(capacities);
    }

    public double get(ModelVariable variable) {
        return get(variable.getName());
    }

    public double get(String variableName) {
        return capacities.getOrDefault(variableName, 0.0);
    }

    public Map<String, Double> getCapacities() {
        return capacities;
    }

    public boolean isEmpty() {
        return capacities.isEmpty();
    }

    @Override
    public String toString() {
        return "CapacitySnapshot(" + capacities + ")";
    }
}
