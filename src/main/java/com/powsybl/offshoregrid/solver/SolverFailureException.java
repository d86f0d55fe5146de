/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.solver;

import com.powsybl.commons.PowsyblException;

/**
 * The solver could not be run or its answer could not be read.
 *
 * @author Offshore grid planning developers
 */
public class SolverFailureException extends PowsyblException {

    public SolverFailureException(String message) {
        super(message);
    }

    public SolverFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
