/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.solver;

import com.powsybl.offshoregrid.model.LinearModel;

import java.nio.file.Path;

/**
 * @author Offshore grid planning developers
 */
public interface MipSolver {

    String getName();

    /**
     * Minimize the model.
     *
     * @param logFile file receiving the solver log
     * @throws SolverFailureException if the solver cannot be run or its answer cannot be read
     */
    MipSolverResult solve(LinearModel model, MipSolverParameters parameters, Path logFile);
}
