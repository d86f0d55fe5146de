/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.solver;

import com.powsybl.offshoregrid.model.*;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a {@link LinearModel} in CPLEX LP format.
 *
 * @author Offshore grid planning developers
 */
public class LpFormatWriter {

    private static final int TERMS_PER_LINE = 8;

    private final LinearModel model;

    public LpFormatWriter(LinearModel model) {
        this.model = Objects.requireNonNull(model);
    }

    public void write(Writer writer) throws IOException {
        Objects.requireNonNull(writer);
        if (model.getVariableCount() == 0) {
            throw new IllegalArgumentException("Cannot write a model without variables");
        }
        writer.write("\\ offshore grid capacity expansion model\n");
        writer.write("Minimize\n obj:");
        int count = 0;
        for (ModelVariable variable : model.getVariables()) {
            writeTerm(writer, variable.getObjectiveCoefficient(), variable, count++);
        }
        writer.write("\nSubject To\n");
        for (LinearConstraint constraint : model.getConstraints()) {
            writeConstraint(writer, constraint);
        }
        writer.write("Bounds\n");
        for (ModelVariable variable : model.getVariables()) {
            writer.write(" " + format(variable.getLowerBound()) + " <= " + variable.getName() + " <= "
                    + (variable.getUpperBound() == Double.POSITIVE_INFINITY ? "+inf" : format(variable.getUpperBound())) + "\n");
        }
        List<ModelVariable> binaries = model.getVariables().stream()
                .filter(v -> v.getType() == VariableType.BINARY)
                .toList();
        if (!binaries.isEmpty()) {
            writer.write("Binaries\n");
            for (ModelVariable variable : binaries) {
                writer.write(" " + variable.getName() + "\n");
            }
        }
        writer.write("End\n");
    }

    private void writeConstraint(Writer writer, LinearConstraint constraint) throws IOException {
        writer.write(" " + constraint.getName() + ":");
        int count = 0;
        for (Map.Entry<ModelVariable, Double> e : constraint.getCoefficients().entrySet()) {
            if (e.getValue() != 0) {
                writeTerm(writer, e.getValue(), e.getKey(), count++);
            }
        }
        if (count == 0) {
            // the format needs at least one term
            writeTerm(writer, 0, model.getVariables().get(0), 0);
        }
        String sense = switch (constraint.getSense()) {
            case LESS_OR_EQUAL -> " <= ";
            case GREATER_OR_EQUAL -> " >= ";
            case EQUAL -> " = ";
        };
        writer.write(sense + format(constraint.getRhs()) + "\n");
    }

    private static void writeTerm(Writer writer, double coefficient, ModelVariable variable, int position) throws IOException {
        if (position > 0 && position % TERMS_PER_LINE == 0) {
            writer.write("\n   ");
        }
        writer.write(coefficient < 0 ? " - " : " + ");
        writer.write(format(Math.abs(coefficient)));
        writer.write(" ");
        writer.write(variable.getName());
    }

    static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
