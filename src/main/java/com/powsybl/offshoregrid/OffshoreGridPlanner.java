/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.offshoregrid.cost.CostModel;
import com.powsybl.offshoregrid.geo.GeoFeasibilityFilter;
import com.powsybl.offshoregrid.model.NetworkModel;
import com.powsybl.offshoregrid.model.NetworkModelBuilder;
import com.powsybl.offshoregrid.network.NetworkDatasets;
import com.powsybl.offshoregrid.network.OffshoreNetwork;
import com.powsybl.offshoregrid.result.CsvResultWriter;
import com.powsybl.offshoregrid.result.ResultExtractor;
import com.powsybl.offshoregrid.result.ResultWriter;
import com.powsybl.offshoregrid.result.RunMetadata;
import com.powsybl.offshoregrid.solver.MipSolver;
import com.powsybl.offshoregrid.solver.MipSolverFactory;
import com.powsybl.offshoregrid.solver.MipSolverParameters;
import com.powsybl.offshoregrid.stage.PlanningResult;
import com.powsybl.offshoregrid.stage.StageOrchestrator;
import com.powsybl.offshoregrid.util.Profiler;
import com.powsybl.offshoregrid.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry point of a planning run: validates the datasets, keeps the geographically viable network, builds the
 * optimization model and solves its stages.
 *
 * @author Offshore grid planning developers
 */
public class OffshoreGridPlanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(OffshoreGridPlanner.class);

    private final OffshoreGridParameters parameters;

    private final MipSolverParameters solverParameters;

    private final MipSolver solver;

    private final Profiler profiler = new Profiler();

    public OffshoreGridPlanner(OffshoreGridParameters parameters, MipSolverParameters solverParameters) {
        this(parameters, solverParameters, MipSolverFactory.find(parameters.getSolverName()).create());
    }

    public OffshoreGridPlanner(OffshoreGridParameters parameters, MipSolverParameters solverParameters, MipSolver solver) {
        this.parameters = Objects.requireNonNull(parameters);
        this.solverParameters = Objects.requireNonNull(solverParameters);
        this.solver = Objects.requireNonNull(solver);
    }

    public OffshoreGridParameters getParameters() {
        return parameters;
    }

    public Profiler getProfiler() {
        return profiler;
    }

    public NetworkModel buildModel(NetworkDatasets datasets, ReportNode reportNode) {
        Objects.requireNonNull(datasets);
        Objects.requireNonNull(reportNode);

        profiler.run("Validate datasets", () -> datasets.validate(parameters.getCostYears()));

        OffshoreNetwork network = profiler.run("Filter viable network",
            () -> new GeoFeasibilityFilter(parameters.getConnectionThresholds(), parameters.getCrossBorderMode()).filter(datasets));
        Reports.reportViableNetwork(reportNode, network.getWindFarms().size(), network.getEnergyHubs().size(),
                network.getSubstations().size(), network.getConnections().size());

        CostModel costModel = new CostModel(parameters.getCostParameters());
        NetworkModel networkModel = profiler.run("Build model",
            () -> new NetworkModelBuilder(costModel, parameters.createNetworkModelParameters()).build(network));
        Reports.reportModelSize(reportNode, networkModel.getLinearModel().getVariableCount(),
                networkModel.getLinearModel().getConstraintCount());
        return networkModel;
    }

    public PlanningResult run(NetworkDatasets datasets, Path outputDirectory, ReportNode reportNode) {
        Objects.requireNonNull(outputDirectory);
        return run(datasets, new CsvResultWriter(outputDirectory, parameters.getFilePrefix()), reportNode);
    }

    public PlanningResult run(NetworkDatasets datasets, ResultWriter resultWriter, ReportNode reportNode) {
        Objects.requireNonNull(resultWriter);
        LOGGER.info("Planning {} with {}", parameters.getFilePrefix(), parameters);

        NetworkModel networkModel = buildModel(datasets, reportNode);
        RunMetadata metadata = new RunMetadata(parameters.getFilePrefix(), parameters.getNote(), networkModel.getVariableCounts());
        ResultExtractor resultExtractor = new ResultExtractor(networkModel, parameters.getCableCountMode(),
                parameters.getTurbineCapacity(), parameters.getSingleYear());
        StageOrchestrator orchestrator = new StageOrchestrator(networkModel, solver, solverParameters, resultExtractor,
                resultWriter, parameters.getStageFailurePolicy(), profiler);

        PlanningResult result = orchestrator.run(parameters.createStages(), metadata, reportNode);
        profiler.logSummary();
        if (!result.isComplete()) {
            LOGGER.warn("Planning {} incomplete: {} of {} stage(s) have a result", parameters.getFilePrefix(),
                    result.getOutcomes().stream().filter(o -> o.getResult().isPresent()).count(), result.getPlannedStageCount());
        }
        return result;
    }
}
