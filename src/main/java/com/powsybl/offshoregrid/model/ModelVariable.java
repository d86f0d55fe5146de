/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.model;

import java.util.Objects;

/**
 * A decision variable with mutable bounds and objective coefficient.
 *
 * @author Offshore grid planning developers
 */
public class ModelVariable {

    private final int index;

    private final String name;

    private final VariableType type;

    private double lowerBound;

    private double upperBound;

    private double objectiveCoefficient;

    ModelVariable(int index, String name, VariableType type, double lowerBound, double upperBound) {
        this.index = index;
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        setLowerBound(lowerBound);
        setUpperBound(upperBound);
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public VariableType getType() {
        return type;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public ModelVariable setLowerBound(double lowerBound) {
        if (Double.isNaN(lowerBound) || lowerBound == Double.POSITIVE_INFINITY) {
            throw new IllegalArgumentException("Invalid lower bound for variable " + name + ": " + lowerBound);
        }
        this.lowerBound = lowerBound;
        return this;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public ModelVariable setUpperBound(double upperBound) {
        if (Double.isNaN(upperBound) || upperBound == Double.NEGATIVE_INFINITY) {
            throw new IllegalArgumentException("Invalid upper bound for variable " + name + ": " + upperBound);
        }
        this.upperBound = upperBound;
        return this;
    }

    public double getObjectiveCoefficient() {
        return objectiveCoefficient;
    }

    public ModelVariable setObjectiveCoefficient(double objectiveCoefficient) {
        this.objectiveCoefficient = objectiveCoefficient;
        return this;
    }

    @Override
    public String toString() {
        return name;
    }
}
