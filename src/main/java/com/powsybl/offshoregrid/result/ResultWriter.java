/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.result;

import java.nio.file.Path;

/**
 * @author Offshore grid planning developers
 */
public interface ResultWriter {

    void writeStage(StageResult result);

    void writeMetadata(RunMetadata metadata);

    /**
     * File where the solver writes its log for the stage of the given year.
     */
    Path getSolverLogFile(int year);
}
