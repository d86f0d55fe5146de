/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.solver;

import com.powsybl.offshoregrid.model.ModelVariable;

import java.util.Arrays;
import java.util.Objects;

/**
 * @author Offshore grid planning developers
 */
public class MipSolverResult {

    private final SolverStatus status;

    private final String terminationCondition;

    private final double objectiveValue;

    private final double[] values;

    public MipSolverResult(SolverStatus status, String terminationCondition, double objectiveValue, double[] values) {
        this.status = Objects.requireNonNull(status);
        this.terminationCondition = Objects.requireNonNull(terminationCondition);
        this.objectiveValue = objectiveValue;
        this.values = Objects.requireNonNull(values);
    }

    public static MipSolverResult failed(SolverStatus status, String terminationCondition) {
        return new MipSolverResult(status, terminationCondition, Double.NaN, new double[0]);
    }

    public SolverStatus getStatus() {
        return status;
    }

    /**
     * Solver specific description of why it stopped.
     */
    public String getTerminationCondition() {
        return terminationCondition;
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }

    public double[] getValues() {
        return values;
    }

    public double getValue(ModelVariable variable) {
        return values[variable.getIndex()];
    }

    /**
     * A usable status with a finite value for every variable.
     */
    public boolean isUsable() {
        return status.isUsable() && values.length > 0 && Arrays.stream(values).allMatch(Double::isFinite);
    }

    @Override
    public String toString() {
        return "MipSolverResult(status=" + status + ", terminationCondition=" + terminationCondition
                + ", objectiveValue=" + objectiveValue + ")";
    }
}
