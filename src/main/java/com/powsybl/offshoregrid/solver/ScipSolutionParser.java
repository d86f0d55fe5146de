/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.solver;

import com.powsybl.offshoregrid.model.LinearModel;
import com.powsybl.offshoregrid.model.ModelVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads a solution file written by the SCIP {@code write solution} command. Variables that do not appear in the file
 * are zero.
 *
 * @author Offshore grid planning developers
 */
public final class ScipSolutionParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScipSolutionParser.class);

    private static final String STATUS_PREFIX = "solution status:";

    private static final String OBJECTIVE_PREFIX = "objective value:";

    private static final String NO_SOLUTION = "no solution available";

    private ScipSolutionParser() {
    }

    public static MipSolverResult parse(BufferedReader reader, LinearModel model) throws IOException {
        Objects.requireNonNull(reader);
        Objects.requireNonNull(model);
        String terminationCondition = null;
        double objectiveValue = Double.NaN;
        boolean solutionAvailable = true;
        double[] values = new double[model.getVariableCount()];
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.startsWith(STATUS_PREFIX)) {
                terminationCondition = trimmed.substring(STATUS_PREFIX.length()).trim();
            } else if (trimmed.startsWith(OBJECTIVE_PREFIX)) {
                objectiveValue = parseNumber(trimmed.substring(OBJECTIVE_PREFIX.length()).trim());
            } else if (trimmed.startsWith(NO_SOLUTION)) {
                solutionAvailable = false;
            } else {
                parseValue(trimmed, model, values);
            }
        }
        if (terminationCondition == null) {
            throw new SolverFailureException("Solution status missing from SCIP solution file");
        }
        SolverStatus status = toStatus(terminationCondition);
        if (!solutionAvailable || !status.isUsable()) {
            return MipSolverResult.failed(status.isUsable() ? SolverStatus.WARNING : status, terminationCondition);
        }
        return new MipSolverResult(status, terminationCondition, objectiveValue, values);
    }

    private static void parseValue(String line, LinearModel model, double[] values) {
        String[] tokens = line.split("\\s+");
        if (tokens.length < 2) {
            throw new SolverFailureException("Unexpected line in SCIP solution file: '" + line + "'");
        }
        Optional<ModelVariable> variable = model.getVariable(tokens[0]);
        if (variable.isPresent()) {
            values[variable.get().getIndex()] = parseNumber(tokens[1]);
        } else {
            LOGGER.debug("Ignoring unknown variable '{}' in SCIP solution file", tokens[0]);
        }
    }

    private static double parseNumber(String token) {
        return switch (token) {
            case "infinity", "+infinity" -> Double.POSITIVE_INFINITY;
            case "-infinity" -> Double.NEGATIVE_INFINITY;
            default -> {
                try {
                    yield Double.parseDouble(token);
                } catch (NumberFormatException e) {
                    throw new SolverFailureException("Invalid number '" + token + "' in SCIP solution file", e);
                }
            }
        };
    }

    static SolverStatus toStatus(String terminationCondition) {
        String condition = terminationCondition.toLowerCase();
        if (condition.startsWith("optimal")) {
            return SolverStatus.OPTIMAL;
        } else if (condition.contains("limit reached")) {
            return SolverStatus.LIMIT_REACHED;
        } else if (condition.startsWith("infeasible")) {
            return SolverStatus.INFEASIBLE;
        } else if (condition.contains("unbounded")) {
            return SolverStatus.ERROR;
        }
        return SolverStatus.WARNING;
    }
}
