/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.stage;

import com.powsybl.offshoregrid.result.StageResult;
import com.powsybl.offshoregrid.solver.SolverFailureException;
import com.powsybl.offshoregrid.solver.SolverStatus;

import java.util.Objects;
import java.util.Optional;

/**
 * Status of a solved stage and its results when the solution is usable.
 *
 * @author Offshore grid planning developers
 */
public class StageOutcome {

    private final int year;

    private final SolverStatus status;

    private final String terminationCondition;

    private final StageResult result;

    public StageOutcome(int year, SolverStatus status, String terminationCondition, StageResult result) {
        this.year = year;
        this.status = Objects.requireNonNull(status);
        this.terminationCondition = Objects.requireNonNull(terminationCondition);
        if (status.isUsable() != (result != null)) {
            throw new IllegalArgumentException("A stage has results if and only if its status is usable: " + status);
        }
        this.result = result;
    }

    public int getYear() {
        return year;
    }

    public SolverStatus getStatus() {
        return status;
    }

    public String getTerminationCondition() {
        return terminationCondition;
    }

    public Optional<StageResult> getResult() {
        return Optional.ofNullable(result);
    }

    /**
     * @throws InfeasibleModelException if the stage is infeasible
     * @throws SolverFailureException if the solver failed for another reason
     */
    public StageResult getResultOrThrow() {
        if (result != null) {
            return result;
        }
        if (status == SolverStatus.INFEASIBLE) {
            throw new InfeasibleModelException("Stage " + year + " is infeasible (" + terminationCondition + ")");
        }
        throw new SolverFailureException("Stage " + year + " has no solution: " + status + " (" + terminationCondition + ")");
    }

    /**
     * A warning when the solution is usable but not proven optimal.
     */
    public Optional<String> getWarning() {
        if (status == SolverStatus.LIMIT_REACHED) {
            return Optional.of("Solver limit reached (" + terminationCondition + "), solution may not be optimal");
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "StageOutcome(year=" + year + ", status=" + status + ", terminationCondition=" + terminationCondition + ")";
    }
}
