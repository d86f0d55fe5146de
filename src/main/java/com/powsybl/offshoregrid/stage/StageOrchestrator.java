/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.stage;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.offshoregrid.StageFailurePolicy;
import com.powsybl.offshoregrid.model.CapacitySnapshot;
import com.powsybl.offshoregrid.model.NetworkModel;
import com.powsybl.offshoregrid.model.StageParameters;
import com.powsybl.offshoregrid.result.ResultExtractor;
import com.powsybl.offshoregrid.result.ResultWriter;
import com.powsybl.offshoregrid.result.RunMetadata;
import com.powsybl.offshoregrid.result.StageResult;
import com.powsybl.offshoregrid.solver.*;
import com.powsybl.offshoregrid.util.Profiler;
import com.powsybl.offshoregrid.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Solves the stages in chronological order on the same model. The rounded capacities of each usable solution
 * become the lower bounds of the next stage, so that built capacity never decreases.
 *
 * @author Offshore grid planning developers
 */
public class StageOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(StageOrchestrator.class);

    private final NetworkModel networkModel;

    private final MipSolver solver;

    private final MipSolverParameters solverParameters;

    private final ResultExtractor resultExtractor;

    private final ResultWriter resultWriter;

    private final StageFailurePolicy failurePolicy;

    private final Profiler profiler;

    public StageOrchestrator(NetworkModel networkModel, MipSolver solver, MipSolverParameters solverParameters,
                             ResultExtractor resultExtractor, ResultWriter resultWriter, StageFailurePolicy failurePolicy,
                             Profiler profiler) {
        this.networkModel = Objects.requireNonNull(networkModel);
        this.solver = Objects.requireNonNull(solver);
        this.solverParameters = Objects.requireNonNull(solverParameters);
        this.resultExtractor = Objects.requireNonNull(resultExtractor);
        this.resultWriter = Objects.requireNonNull(resultWriter);
        this.failurePolicy = Objects.requireNonNull(failurePolicy);
        this.profiler = Objects.requireNonNull(profiler);
    }

    public PlanningResult run(List<StageParameters> stages, RunMetadata metadata, ReportNode reportNode) {
        Objects.requireNonNull(stages);
        Objects.requireNonNull(metadata);
        Objects.requireNonNull(reportNode);

        List<StageOutcome> outcomes = new ArrayList<>(stages.size());
        CapacitySnapshot lowerBounds = CapacitySnapshot.EMPTY;
        for (StageParameters stage : stages) {
            int year = stage.getYear();
            ReportNode stageReportNode = Reports.createStageReportNode(reportNode, year);
            networkModel.applyStage(stage, lowerBounds);

            MipSolverResult solverResult = solve(year);
            StageOutcome outcome;
            if (solverResult.isUsable()) {
                CapacitySnapshot previous = lowerBounds;
                StageResult result = profiler.run("Extract results " + year, () -> resultExtractor.extract(stage, solverResult, previous));
                resultWriter.writeStage(result);
                lowerBounds = CapacitySnapshot.of(networkModel.getCapacityVariables(), solverResult.getValues(),
                        networkModel.getParameters().getZeroThreshold());
                outcome = new StageOutcome(year, solverResult.getStatus(), solverResult.getTerminationCondition(), result);
                if (solverResult.getStatus() == SolverStatus.LIMIT_REACHED) {
                    LOGGER.warn("Stage {}: solver stopped on a limit ({}), objective {}", year,
                            solverResult.getTerminationCondition(), solverResult.getObjectiveValue());
                    Reports.reportLimitReached(stageReportNode, year, solverResult.getTerminationCondition());
                } else {
                    LOGGER.info("Stage {}: {} ({}), objective {}", year, solverResult.getStatus(),
                            solverResult.getTerminationCondition(), solverResult.getObjectiveValue());
                }
                Reports.reportStageSolved(stageReportNode, year, solverResult.getStatus().name(), result.getTotalCost());
                metadata.addStage(new RunMetadata.StageSummary(year, solverResult.getStatus(),
                        solverResult.getTerminationCondition(), result.getTotalCost()));
            } else {
                // a usable status without finite values cannot seed the next stage
                SolverStatus status = solverResult.getStatus().isUsable() ? SolverStatus.WARNING : solverResult.getStatus();
                outcome = new StageOutcome(year, status, solverResult.getTerminationCondition(), null);
                LOGGER.error("Stage {}: {} ({}), no result", year, status, solverResult.getTerminationCondition());
                Reports.reportStageFailed(stageReportNode, year, status.name(), solverResult.getTerminationCondition());
                metadata.addStage(new RunMetadata.StageSummary(year, status, solverResult.getTerminationCondition(), null));
            }
            outcomes.add(outcome);

            if (!outcome.getStatus().isUsable() && failurePolicy == StageFailurePolicy.HALT) {
                int skipped = stages.size() - outcomes.size();
                if (skipped > 0) {
                    LOGGER.warn("Planning halted after stage {}, {} stage(s) skipped", year, skipped);
                    Reports.reportStagesSkipped(reportNode, skipped);
                }
                break;
            }
        }
        resultWriter.writeMetadata(metadata);
        return new PlanningResult(outcomes, stages.size(), metadata);
    }

    private MipSolverResult solve(int year) {
        Path logFile = resultWriter.getSolverLogFile(year);
        LOGGER.info("Solving stage {} with {}", year, solver.getName());
        try {
            return profiler.run("Solve " + year, () -> solver.solve(networkModel.getLinearModel(), solverParameters, logFile));
        } catch (SolverFailureException e) {
            LOGGER.error("Solver failure on stage {}: {}", year, e.getMessage(), e);
            return MipSolverResult.failed(SolverStatus.ERROR, String.valueOf(e.getMessage()));
        }
    }
}
