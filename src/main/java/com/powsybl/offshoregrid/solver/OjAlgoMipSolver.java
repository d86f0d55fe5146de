/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.solver;

import com.google.common.base.Stopwatch;
import com.powsybl.offshoregrid.model.*;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;
import org.ojalgo.optimisation.integer.IntegerStrategy;
import org.ojalgo.type.context.NumberContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * In-process solver based on the ojAlgo branch and bound.
 *
 * @author Offshore grid planning developers
 */
public class OjAlgoMipSolver implements MipSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(OjAlgoMipSolver.class);

    public static final String NAME = "ojalgo";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public MipSolverResult solve(LinearModel model, MipSolverParameters parameters, Path logFile) {
        Objects.requireNonNull(model);
        Objects.requireNonNull(parameters);
        Objects.requireNonNull(logFile);

        ExpressionsBasedModel ojModel = toOjAlgoModel(model, parameters);

        Stopwatch stopwatch = Stopwatch.createStarted();
        Optimisation.Result result;
        try {
            result = ojModel.minimise();
        } catch (RuntimeException e) {
            throw new SolverFailureException("ojAlgo failed: " + e.getMessage(), e);
        }
        stopwatch.stop();

        Optimisation.State state = result.getState();
        SolverStatus status = toStatus(state);
        MipSolverResult solverResult;
        if (status.isUsable()) {
            double[] values = new double[model.getVariableCount()];
            for (int i = 0; i < values.length; i++) {
                values[i] = result.doubleValue(i);
            }
            solverResult = new MipSolverResult(status, state.name(), model.evaluateObjective(values), values);
        } else {
            solverResult = MipSolverResult.failed(status, state.name());
        }
        LOGGER.debug("ojAlgo terminated with state {} in {} ms", state, stopwatch.elapsed(TimeUnit.MILLISECONDS));
        writeLog(model, parameters, solverResult, stopwatch, logFile);
        return solverResult;
    }

    static ExpressionsBasedModel toOjAlgoModel(LinearModel model, MipSolverParameters parameters) {
        ExpressionsBasedModel ojModel = new ExpressionsBasedModel();
        ojModel.options.time_abort = (long) (parameters.getTimeLimit() * 1000);
        if (parameters.getRelativeGap() > 0) {
            ojModel.options.integer(IntegerStrategy.DEFAULT.withGapTolerance(NumberContext.of(gapPrecision(parameters.getRelativeGap()))));
        }

        Variable[] variables = new Variable[model.getVariableCount()];
        for (ModelVariable variable : model.getVariables()) {
            Variable ojVariable = ojModel.newVariable(variable.getName())
                    .lower(variable.getLowerBound())
                    .weight(variable.getObjectiveCoefficient());
            if (variable.getUpperBound() != Double.POSITIVE_INFINITY) {
                ojVariable.upper(variable.getUpperBound());
            }
            if (variable.getType() == VariableType.BINARY) {
                ojVariable.integer(true);
            }
            variables[variable.getIndex()] = ojVariable;
        }

        for (LinearConstraint constraint : model.getConstraints()) {
            Expression expression = ojModel.newExpression(constraint.getName());
            for (Map.Entry<ModelVariable, Double> e : constraint.getCoefficients().entrySet()) {
                if (e.getValue() != 0) {
                    expression.set(variables[e.getKey().getIndex()], e.getValue());
                }
            }
            switch (constraint.getSense()) {
                case LESS_OR_EQUAL -> expression.upper(constraint.getRhs());
                case GREATER_OR_EQUAL -> expression.lower(constraint.getRhs());
                case EQUAL -> expression.level(constraint.getRhs());
            }
        }
        return ojModel;
    }

    /**
     * Number of significant digits matching a relative gap, 1e-4 giving 4.
     */
    static int gapPrecision(double relativeGap) {
        return Math.max(1, (int) Math.ceil(-Math.log10(relativeGap) - 1e-9));
    }

    static SolverStatus toStatus(Optimisation.State state) {
        if (state.isOptimal()) {
            return SolverStatus.OPTIMAL;
        } else if (state.isFeasible()) {
            return SolverStatus.LIMIT_REACHED;
        } else if (state == Optimisation.State.INFEASIBLE) {
            return SolverStatus.INFEASIBLE;
        } else if (state.isFailure()) {
            return SolverStatus.ERROR;
        }
        return SolverStatus.WARNING;
    }

    private static void writeLog(LinearModel model, MipSolverParameters parameters, MipSolverResult result,
                                 Stopwatch stopwatch, Path logFile) {
        try (BufferedWriter writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8)) {
            writer.write("solver: " + NAME);
            writer.newLine();
            writer.write("variables: " + model.getVariableCount() + ", constraints: " + model.getConstraintCount());
            writer.newLine();
            writer.write("time limit: " + parameters.getTimeLimit() + " s, relative gap: " + parameters.getRelativeGap());
            writer.newLine();
            writer.write("termination: " + result.getTerminationCondition() + " (" + result.getStatus() + ")");
            writer.newLine();
            writer.write("objective: " + result.getObjectiveValue());
            writer.newLine();
            writer.write("solving time: " + stopwatch.elapsed(TimeUnit.MILLISECONDS) + " ms");
            writer.newLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
