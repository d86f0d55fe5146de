/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.result;

import com.powsybl.offshoregrid.solver.SolverStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Description of a planning run written next to its results.
 *
 * @author Offshore grid planning developers
 */
public class RunMetadata {

    /**
     * @param totalCost null when the stage has no result
     */
    public record StageSummary(int year, SolverStatus status, String terminationCondition, Double totalCost) {
    }

    private final String filePrefix;

    private final String note;

    private final Map<String, Integer> variableCounts;

    private final List<StageSummary> stages = new ArrayList<>();

    public RunMetadata(String filePrefix, String note, Map<String, Integer> variableCounts) {
        this.filePrefix = Objects.requireNonNull(filePrefix);
        this.note = Objects.requireNonNull(note);
        this.variableCounts = Collections.unmodifiableMap(new LinkedHashMap<>(variableCounts));
    }

    public String getFilePrefix() {
        return filePrefix;
    }

    public String getNote() {
        return note;
    }

    public Map<String, Integer> getVariableCounts() {
        return variableCounts;
    }

    public List<StageSummary> getStages() {
        return Collections.unmodifiableList(stages);
    }

    public void addStage(StageSummary stage) {
        stages.add(Objects.requireNonNull(stage));
    }
}
