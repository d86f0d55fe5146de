/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.stage;

import com.powsybl.offshoregrid.result.RunMetadata;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * @author Offshore grid planning developers
 */
public class PlanningResult {

    private final List<StageOutcome> outcomes;

    private final int plannedStageCount;

    private final RunMetadata metadata;

    public PlanningResult(List<StageOutcome> outcomes, int plannedStageCount, RunMetadata metadata) {
        this.outcomes = List.copyOf(outcomes);
        this.plannedStageCount = plannedStageCount;
        this.metadata = Objects.requireNonNull(metadata);
    }

    /**
     * Outcomes of the stages that were run, in chronological order.
     */
    public List<StageOutcome> getOutcomes() {
        return outcomes;
    }

    public Optional<StageOutcome> getOutcome(int year) {
        return outcomes.stream().filter(o -> o.getYear() == year).findFirst();
    }

    public int getPlannedStageCount() {
        return plannedStageCount;
    }

    public RunMetadata getMetadata() {
        return metadata;
    }

    /**
     * True if every planned stage has been run and has a usable solution.
     */
    public boolean isComplete() {
        return outcomes.size() == plannedStageCount && outcomes.stream().allMatch(o -> o.getStatus().isUsable());
    }
}
