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
import java.util.Map;
import java.util.Objects;

/**
 * A linear constraint {@code sum(coefficient * variable) sense rhs}.
 *
 * @author Offshore grid planning developers
 */
public class LinearConstraint {

    private final String name;

    private final ConstraintSense sense;

    private final Map<ModelVariable, Double> coefficients = new LinkedHashMap<>();

    private double rhs;

    LinearConstraint(String name, ConstraintSense sense, double rhs) {
        this.name = Objects.requireNonNull(name);
        this.sense = Objects.requireNonNull(sense);
        this.rhs = rhs;
    }

    public String getName() {
        return name;
    }

    public ConstraintSense getSense() {
        return sense;
    }

    public double getRhs() {
        return rhs;
    }

    public LinearConstraint setRhs(double rhs) {
        this.rhs = rhs;
        return this;
    }

    /**
     * Add a term, merged with an existing term on the same variable.
     */
    public LinearConstraint addTerm(ModelVariable variable, double coefficient) {
        coefficients.merge(Objects.requireNonNull(variable), coefficient, Double::sum);
        return this;
    }

    public LinearConstraint setCoefficient(ModelVariable variable, double coefficient) {
        coefficients.put(Objects.requireNonNull(variable), coefficient);
        return this;
    }

    public Map<ModelVariable, Double> getCoefficients() {
        return Collections.unmodifiableMap(coefficients);
    }

    public double getActivity(double[] values) {
        double activity = 0;
        for (Map.Entry<ModelVariable, Double> e : coefficients.entrySet()) {
            activity += e.getValue() * values[e.getKey().getIndex()];
        }
        return activity;
    }

    public boolean isSatisfied(double[] values, double tolerance) {
        double activity = getActivity(values);
        return switch (sense) {
            case LESS_OR_EQUAL -> activity <= rhs + tolerance;
            case GREATER_OR_EQUAL -> activity >= rhs - tolerance;
            case EQUAL -> Math.abs(activity - rhs) <= tolerance;
        };
    }

    @Override
    public String toString() {
        return name;
    }
}
