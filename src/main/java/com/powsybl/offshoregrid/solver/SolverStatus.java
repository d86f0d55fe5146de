/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.solver;

/**
 * @author Offshore grid planning developers
 */
public enum SolverStatus {
    /**
     * Proven optimal solution.
     */
    OPTIMAL,
    /**
     * A limit (time, nodes, gap, solutions) stopped the search with a feasible solution.
     */
    LIMIT_REACHED,
    INFEASIBLE,
    ERROR,
    /**
     * Solver terminated with no usable solution for another reason.
     */
    WARNING;

    public boolean isUsable() {
        return this == OPTIMAL || this == LIMIT_REACHED;
    }
}
