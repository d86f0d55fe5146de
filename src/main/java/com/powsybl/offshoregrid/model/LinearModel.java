/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.model;

import java.util.*;

/**
 * Solver independent mixed integer linear program, minimized.
 *
 * @author Offshore grid planning developers
 */
public class LinearModel {

    private final List<ModelVariable> variables = new ArrayList<>();

    private final Map<String, ModelVariable> variablesByName = new HashMap<>();

    private final List<LinearConstraint> constraints = new ArrayList<>();

    private final Map<String, LinearConstraint> constraintsByName = new HashMap<>();

    public ModelVariable addVariable(String name, VariableType type, double lowerBound, double upperBound) {
        if (variablesByName.containsKey(name)) {
            throw new IllegalArgumentException("Variable " + name + " already exists");
        }
        ModelVariable variable = new ModelVariable(variables.size(), name, type, lowerBound, upperBound);
        variables.add(variable);
        variablesByName.put(name, variable);
        return variable;
    }

    public ModelVariable addContinuousVariable(String name, double lowerBound, double upperBound) {
        return addVariable(name, VariableType.CONTINUOUS, lowerBound, upperBound);
    }

    public ModelVariable addBinaryVariable(String name) {
        return addVariable(name, VariableType.BINARY, 0, 1);
    }

    public LinearConstraint addConstraint(String name, ConstraintSense sense, double rhs) {
        if (constraintsByName.containsKey(name)) {
            throw new IllegalArgumentException("Constraint " + name + " already exists");
        }
        LinearConstraint constraint = new LinearConstraint(name, sense, rhs);
        constraints.add(constraint);
        constraintsByName.put(name, constraint);
        return constraint;
    }

    public List<ModelVariable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public Optional<ModelVariable> getVariable(String name) {
        return Optional.ofNullable(variablesByName.get(name));
    }

    public List<LinearConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public Optional<LinearConstraint> getConstraint(String name) {
        return Optional.ofNullable(constraintsByName.get(name));
    }

    public int getVariableCount() {
        return variables.size();
    }

    public int getConstraintCount() {
        return constraints.size();
    }

    public double evaluateObjective(double[] values) {
        Objects.requireNonNull(values);
        if (values.length != variables.size()) {
            throw new IllegalArgumentException("Expected " + variables.size() + " values, got " + values.length);
        }
        double objective = 0;
        for (ModelVariable variable : variables) {
            objective += variable.getObjectiveCoefficient() * values[variable.getIndex()];
        }
        return objective;
    }
}
