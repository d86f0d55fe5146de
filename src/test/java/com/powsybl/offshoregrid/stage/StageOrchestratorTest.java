/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.stage;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.iidm.network.Country;
import com.powsybl.offshoregrid.CableCountMode;
import com.powsybl.offshoregrid.ModelType;
import com.powsybl.offshoregrid.StageFailurePolicy;
import com.powsybl.offshoregrid.model.*;
import com.powsybl.offshoregrid.result.ResultExtractor;
import com.powsybl.offshoregrid.result.ResultWriter;
import com.powsybl.offshoregrid.result.RunMetadata;
import com.powsybl.offshoregrid.result.StageResult;
import com.powsybl.offshoregrid.solver.*;
import com.powsybl.offshoregrid.util.Profiler;
import com.powsybl.offshoregrid.util.Reports;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * @author Offshore grid planning developers
 */
class StageOrchestratorTest {

    private static final List<StageParameters> STAGES = List.of(
            new StageParameters(2030, Map.of(Country.DE, 0.3)),
            new StageParameters(2040, Map.of(Country.DE, 0.7)),
            new StageParameters(2050, Map.of(Country.DE, 1.0)));

    private NetworkModel model;

    private MipSolver solver;

    private ResultWriter resultWriter;

    private RunMetadata metadata;

    private ReportNode reportNode;

    @BeforeEach
    void setUp() {
        model = NetworkModelFactory.buildSimple(ModelType.COMBINED);
        solver = mock(MipSolver.class);
        when(solver.getName()).thenReturn("mock");
        resultWriter = mock(ResultWriter.class);
        when(resultWriter.getSolverLogFile(anyInt())).thenReturn(Path.of("solverlog.txt"));
        metadata = new RunMetadata("r_mf_c_in", "test", model.getVariableCounts());
        reportNode = Reports.createRootReportNode("r_mf_c_in");
    }

    private MipSolverResult optimal(double windFarmCapacity) {
        double[] values = new double[model.getLinearModel().getVariableCount()];
        values[model.getLinearModel().getVariable("wf_1_cap").orElseThrow().getIndex()] = windFarmCapacity;
        return new MipSolverResult(SolverStatus.OPTIMAL, "optimal", 1.0, values);
    }

    private StageOrchestrator createOrchestrator(StageFailurePolicy policy) {
        ResultExtractor extractor = new ResultExtractor(model, CableCountMode.DISCRETE, 15, 2040);
        return new StageOrchestrator(model, solver, new MipSolverParameters(), extractor, resultWriter, policy, new Profiler());
    }

    private ModelVariable windFarmCapacity() {
        return model.getLinearModel().getVariable("wf_1_cap").orElseThrow();
    }

    @Test
    void testAllStagesSolved() {
        when(solver.solve(any(), any(), any())).thenReturn(optimal(40.4), optimal(80), optimal(100));

        PlanningResult result = createOrchestrator(StageFailurePolicy.HALT).run(STAGES, metadata, reportNode);

        assertTrue(result.isComplete());
        assertEquals(3, result.getOutcomes().size());
        assertEquals(List.of(2030, 2040, 2050), result.getOutcomes().stream().map(StageOutcome::getYear).toList());
        StageResult last = result.getOutcome(2050).orElseThrow().getResultOrThrow();
        assertEquals(100, last.getWindFarms().get(0).capacity(), 0);
        // capacities realized in 2040 bound the 2050 stage
        assertEquals(80, windFarmCapacity().getLowerBound(), 0);
        verify(resultWriter, times(3)).writeStage(any());
        verify(resultWriter).writeMetadata(metadata);
        assertEquals(3, metadata.getStages().size());
        assertEquals(3, reportNode.getChildren().size());
    }

    @Test
    void testHaltOnInfeasibleStage() {
        when(solver.solve(any(), any(), any()))
                .thenReturn(optimal(40.4), MipSolverResult.failed(SolverStatus.INFEASIBLE, "infeasible"), optimal(100));

        PlanningResult result = createOrchestrator(StageFailurePolicy.HALT).run(STAGES, metadata, reportNode);

        assertFalse(result.isComplete());
        assertEquals(2, result.getOutcomes().size());
        assertEquals(3, result.getPlannedStageCount());
        StageOutcome failed = result.getOutcome(2040).orElseThrow();
        assertEquals(SolverStatus.INFEASIBLE, failed.getStatus());
        assertTrue(failed.getResult().isEmpty());
        assertThrows(InfeasibleModelException.class, failed::getResultOrThrow);
        assertTrue(result.getOutcome(2050).isEmpty());
        assertEquals(40, windFarmCapacity().getLowerBound(), 0);
        verify(solver, times(2)).solve(any(), any(), any());
        verify(resultWriter, times(1)).writeStage(any());
        verify(resultWriter).writeMetadata(metadata);
        assertNull(metadata.getStages().get(1).totalCost());
        // one node per stage plus the skipped stages warning
        assertEquals(3, reportNode.getChildren().size());
    }

    @Test
    void testContinueWithLastBounds() {
        when(solver.solve(any(), any(), any()))
                .thenReturn(optimal(40.4), MipSolverResult.failed(SolverStatus.INFEASIBLE, "infeasible"), optimal(100));

        PlanningResult result = createOrchestrator(StageFailurePolicy.CONTINUE_WITH_LAST_BOUNDS).run(STAGES, metadata, reportNode);

        assertEquals(3, result.getOutcomes().size());
        assertFalse(result.isComplete());
        assertTrue(result.getOutcome(2050).orElseThrow().getResult().isPresent());
        verify(solver, times(3)).solve(any(), any(), any());
        verify(resultWriter, times(2)).writeStage(any());
    }

    @Test
    void testSolverFailure() {
        when(solver.solve(any(), any(), any())).thenThrow(new SolverFailureException("SCIP exited with code 1"));

        PlanningResult result = createOrchestrator(StageFailurePolicy.HALT).run(STAGES, metadata, reportNode);

        assertEquals(1, result.getOutcomes().size());
        StageOutcome outcome = result.getOutcomes().get(0);
        assertEquals(SolverStatus.ERROR, outcome.getStatus());
        assertEquals("SCIP exited with code 1", outcome.getTerminationCondition());
        assertThrows(SolverFailureException.class, outcome::getResultOrThrow);
        verify(resultWriter, never()).writeStage(any());
        verify(resultWriter).writeMetadata(metadata);
    }

    @Test
    void testLimitReached() {
        double[] values = optimal(30).getValues();
        when(solver.solve(any(), any(), any()))
                .thenReturn(new MipSolverResult(SolverStatus.LIMIT_REACHED, "time limit reached", 1.0, values));

        PlanningResult result = createOrchestrator(StageFailurePolicy.HALT).run(STAGES.subList(0, 1), metadata, reportNode);

        assertTrue(result.isComplete());
        StageOutcome outcome = result.getOutcomes().get(0);
        assertTrue(outcome.getResult().isPresent());
        assertTrue(outcome.getWarning().orElseThrow().contains("time limit reached"));
    }

    @Test
    void testUsableStatusWithoutValues() {
        double[] values = optimal(30).getValues();
        values[0] = Double.NaN;
        when(solver.solve(any(), any(), any())).thenReturn(new MipSolverResult(SolverStatus.OPTIMAL, "optimal", 1.0, values));

        PlanningResult result = createOrchestrator(StageFailurePolicy.HALT).run(STAGES, metadata, reportNode);

        assertEquals(1, result.getOutcomes().size());
        assertEquals(SolverStatus.WARNING, result.getOutcomes().get(0).getStatus());
    }

    @Test
    void testStageOutcomeConsistency() {
        assertThrows(IllegalArgumentException.class, () -> new StageOutcome(2030, SolverStatus.OPTIMAL, "optimal", null));
        assertTrue(new StageOutcome(2030, SolverStatus.ERROR, "error", null).getWarning().isEmpty());
    }
}
