/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Offshore grid planning developers
 */
class LinearModelTest {

    @Test
    void testVariables() {
        LinearModel model = new LinearModel();
        ModelVariable x = model.addContinuousVariable("x", 0, Double.POSITIVE_INFINITY);
        ModelVariable b = model.addBinaryVariable("b");
        assertEquals(0, x.getIndex());
        assertEquals(1, b.getIndex());
        assertEquals(VariableType.BINARY, b.getType());
        assertEquals(1, b.getUpperBound(), 0);
        assertSame(x, model.getVariable("x").orElseThrow());
        assertTrue(model.getVariable("y").isEmpty());
        assertEquals(List.of(x, b), model.getVariables());
        assertThrows(IllegalArgumentException.class, () -> model.addContinuousVariable("x", 0, 1));
    }

    @Test
    void testInvalidBounds() {
        LinearModel model = new LinearModel();
        ModelVariable x = model.addContinuousVariable("x", 0, 10);
        assertThrows(IllegalArgumentException.class, () -> x.setLowerBound(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> x.setLowerBound(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> x.setUpperBound(Double.NEGATIVE_INFINITY));
        x.setLowerBound(5).setUpperBound(Double.POSITIVE_INFINITY);
        assertEquals(5, x.getLowerBound(), 0);
    }

    @Test
    void testConstraints() {
        LinearModel model = new LinearModel();
        ModelVariable x = model.addContinuousVariable("x", 0, 10);
        ModelVariable y = model.addContinuousVariable("y", 0, 10);
        LinearConstraint c = model.addConstraint("c", ConstraintSense.GREATER_OR_EQUAL, 4)
                .addTerm(x, 1)
                .addTerm(y, 2)
                .addTerm(x, 1);
        assertEquals(2, c.getCoefficients().size());
        assertEquals(2, c.getCoefficients().get(x), 0);
        assertEquals(8, c.getActivity(new double[] {1, 3}), 0);
        assertTrue(c.isSatisfied(new double[] {1, 1}, 0));
        assertFalse(c.isSatisfied(new double[] {0.5, 1}, 1e-6));
        assertTrue(c.isSatisfied(new double[] {0.5, 1}, 1));

        c.setCoefficient(y, -1).setRhs(0);
        assertEquals(-1, c.getCoefficients().get(y), 0);
        assertEquals(0, c.getRhs(), 0);

        LinearConstraint e = model.addConstraint("e", ConstraintSense.EQUAL, 3).addTerm(y, 1);
        assertTrue(e.isSatisfied(new double[] {0, 3}, 0));
        assertFalse(e.isSatisfied(new double[] {0, 2}, 0.5));
        LinearConstraint l = model.addConstraint("l", ConstraintSense.LESS_OR_EQUAL, 3).addTerm(y, 1);
        assertTrue(l.isSatisfied(new double[] {0, 2}, 0));

        assertEquals(3, model.getConstraintCount());
        assertSame(e, model.getConstraint("e").orElseThrow());
        assertThrows(IllegalArgumentException.class, () -> model.addConstraint("c", ConstraintSense.EQUAL, 0));
    }

    @Test
    void testObjective() {
        LinearModel model = new LinearModel();
        model.addContinuousVariable("x", 0, 10).setObjectiveCoefficient(2);
        model.addBinaryVariable("b").setObjectiveCoefficient(100);
        assertEquals(120, model.evaluateObjective(new double[] {10, 1}), 0);
        assertThrows(IllegalArgumentException.class, () -> model.evaluateObjective(new double[] {1}));
    }
}
