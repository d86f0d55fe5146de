/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.solver;

import com.powsybl.commons.config.PlatformConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Branch and bound limits and numerical tolerances. Negative round limits mean no limit.
 *
 * @author Offshore grid planning developers
 */
public class MipSolverParameters {

    public static final String MODULE_NAME = "offshore-grid-solver-parameters";

    public static final String RELATIVE_GAP_PARAM_NAME = "relativeGap";
    public static final String NODE_LIMIT_PARAM_NAME = "nodeLimit";
    public static final String SOLUTION_LIMIT_PARAM_NAME = "solutionLimit";
    public static final String TIME_LIMIT_PARAM_NAME = "timeLimit";
    public static final String FEASIBILITY_TOLERANCE_PARAM_NAME = "feasibilityTolerance";
    public static final String DUAL_FEASIBILITY_TOLERANCE_PARAM_NAME = "dualFeasibilityTolerance";
    public static final String PRESOLVE_MAX_ROUNDS_PARAM_NAME = "presolveMaxRounds";
    public static final String PROPAGATION_MAX_ROUNDS_PARAM_NAME = "propagationMaxRounds";
    public static final String PROPAGATION_MAX_ROUNDS_ROOT_PARAM_NAME = "propagationMaxRoundsRoot";
    public static final String SEPARATION_MAX_ROUNDS_PARAM_NAME = "separationMaxRounds";
    public static final String VERBOSITY_PARAM_NAME = "verbosity";
    public static final String SCIP_EXECUTABLE_PARAM_NAME = "scipExecutable";

    public static final double RELATIVE_GAP_DEFAULT_VALUE = 0;
    public static final long NODE_LIMIT_DEFAULT_VALUE = 10000;
    public static final int SOLUTION_LIMIT_DEFAULT_VALUE = -1;
    public static final double TIME_LIMIT_DEFAULT_VALUE = 3600;
    public static final double FEASIBILITY_TOLERANCE_DEFAULT_VALUE = 1e-5;
    public static final double DUAL_FEASIBILITY_TOLERANCE_DEFAULT_VALUE = 1e-5;
    public static final int MAX_ROUNDS_DEFAULT_VALUE = -1;
    public static final int VERBOSITY_DEFAULT_VALUE = 4;
    public static final String SCIP_EXECUTABLE_DEFAULT_VALUE = "scip";

    private double relativeGap = RELATIVE_GAP_DEFAULT_VALUE;

    private long nodeLimit = NODE_LIMIT_DEFAULT_VALUE;

    private int solutionLimit = SOLUTION_LIMIT_DEFAULT_VALUE;

    private double timeLimit = TIME_LIMIT_DEFAULT_VALUE;

    private double feasibilityTolerance = FEASIBILITY_TOLERANCE_DEFAULT_VALUE;

    private double dualFeasibilityTolerance = DUAL_FEASIBILITY_TOLERANCE_DEFAULT_VALUE;

    private int presolveMaxRounds = MAX_ROUNDS_DEFAULT_VALUE;

    private int propagationMaxRounds = MAX_ROUNDS_DEFAULT_VALUE;

    private int propagationMaxRoundsRoot = MAX_ROUNDS_DEFAULT_VALUE;

    private int separationMaxRounds = MAX_ROUNDS_DEFAULT_VALUE;

    private int verbosity = VERBOSITY_DEFAULT_VALUE;

    private String scipExecutable = SCIP_EXECUTABLE_DEFAULT_VALUE;

    public double getRelativeGap() {
        return relativeGap;
    }

    public MipSolverParameters setRelativeGap(double relativeGap) {
        if (!(relativeGap >= 0)) {
            throw new IllegalArgumentException("Invalid relative gap: " + relativeGap);
        }
        this.relativeGap = relativeGap;
        return this;
    }

    public long getNodeLimit() {
        return nodeLimit;
    }

    public MipSolverParameters setNodeLimit(long nodeLimit) {
        if (nodeLimit < -1) {
            throw new IllegalArgumentException("Invalid node limit: " + nodeLimit);
        }
        this.nodeLimit = nodeLimit;
        return this;
    }

    public int getSolutionLimit() {
        return solutionLimit;
    }

    public MipSolverParameters setSolutionLimit(int solutionLimit) {
        if (solutionLimit < -1) {
            throw new IllegalArgumentException("Invalid solution limit: " + solutionLimit);
        }
        this.solutionLimit = solutionLimit;
        return this;
    }

    /**
     * Time limit in seconds.
     */
    public double getTimeLimit() {
        return timeLimit;
    }

    public MipSolverParameters setTimeLimit(double timeLimit) {
        if (!(timeLimit > 0)) {
            throw new IllegalArgumentException("Invalid time limit: " + timeLimit);
        }
        this.timeLimit = timeLimit;
        return this;
    }

    public double getFeasibilityTolerance() {
        return feasibilityTolerance;
    }

    public MipSolverParameters setFeasibilityTolerance(double feasibilityTolerance) {
        this.feasibilityTolerance = checkTolerance(feasibilityTolerance);
        return this;
    }

    public double getDualFeasibilityTolerance() {
        return dualFeasibilityTolerance;
    }

    public MipSolverParameters setDualFeasibilityTolerance(double dualFeasibilityTolerance) {
        this.dualFeasibilityTolerance = checkTolerance(dualFeasibilityTolerance);
        return this;
    }

    private static double checkTolerance(double tolerance) {
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("Invalid tolerance: " + tolerance);
        }
        return tolerance;
    }

    public int getPresolveMaxRounds() {
        return presolveMaxRounds;
    }

    public MipSolverParameters setPresolveMaxRounds(int presolveMaxRounds) {
        this.presolveMaxRounds = presolveMaxRounds;
        return this;
    }

    public int getPropagationMaxRounds() {
        return propagationMaxRounds;
    }

    public MipSolverParameters setPropagationMaxRounds(int propagationMaxRounds) {
        this.propagationMaxRounds = propagationMaxRounds;
        return this;
    }

    public int getPropagationMaxRoundsRoot() {
        return propagationMaxRoundsRoot;
    }

    public MipSolverParameters setPropagationMaxRoundsRoot(int propagationMaxRoundsRoot) {
        this.propagationMaxRoundsRoot = propagationMaxRoundsRoot;
        return this;
    }

    public int getSeparationMaxRounds() {
        return separationMaxRounds;
    }

    public MipSolverParameters setSeparationMaxRounds(int separationMaxRounds) {
        this.separationMaxRounds = separationMaxRounds;
        return this;
    }

    public int getVerbosity() {
        return verbosity;
    }

    public MipSolverParameters setVerbosity(int verbosity) {
        if (verbosity < 0 || verbosity > 5) {
            throw new IllegalArgumentException("Invalid verbosity: " + verbosity);
        }
        this.verbosity = verbosity;
        return this;
    }

    public String getScipExecutable() {
        return scipExecutable;
    }

    public MipSolverParameters setScipExecutable(String scipExecutable) {
        if (scipExecutable == null || scipExecutable.isBlank()) {
            throw new IllegalArgumentException("Invalid SCIP executable: " + scipExecutable);
        }
        this.scipExecutable = scipExecutable;
        return this;
    }

    /**
     * The parameters under their SCIP setting names.
     */
    public Map<String, String> toScipSettings() {
        Map<String, String> settings = new LinkedHashMap<>();
        settings.put("limits/gap", Double.toString(relativeGap));
        settings.put("limits/nodes", Long.toString(nodeLimit));
        settings.put("limits/solutions", Integer.toString(solutionLimit));
        settings.put("limits/time", Double.toString(timeLimit));
        settings.put("numerics/feastol", Double.toString(feasibilityTolerance));
        settings.put("numerics/dualfeastol", Double.toString(dualFeasibilityTolerance));
        settings.put("presolving/maxrounds", Integer.toString(presolveMaxRounds));
        settings.put("propagating/maxrounds", Integer.toString(propagationMaxRounds));
        settings.put("propagating/maxroundsroot", Integer.toString(propagationMaxRoundsRoot));
        settings.put("separating/maxrounds", Integer.toString(separationMaxRounds));
        settings.put("display/verblevel", Integer.toString(verbosity));
        return settings;
    }

    public static MipSolverParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static MipSolverParameters load(PlatformConfig platformConfig) {
        MipSolverParameters parameters = new MipSolverParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setRelativeGap(config.getDoubleProperty(RELATIVE_GAP_PARAM_NAME, RELATIVE_GAP_DEFAULT_VALUE))
                .setNodeLimit(config.getLongProperty(NODE_LIMIT_PARAM_NAME, NODE_LIMIT_DEFAULT_VALUE))
                .setSolutionLimit(config.getIntProperty(SOLUTION_LIMIT_PARAM_NAME, SOLUTION_LIMIT_DEFAULT_VALUE))
                .setTimeLimit(config.getDoubleProperty(TIME_LIMIT_PARAM_NAME, TIME_LIMIT_DEFAULT_VALUE))
                .setFeasibilityTolerance(config.getDoubleProperty(FEASIBILITY_TOLERANCE_PARAM_NAME, FEASIBILITY_TOLERANCE_DEFAULT_VALUE))
                .setDualFeasibilityTolerance(config.getDoubleProperty(DUAL_FEASIBILITY_TOLERANCE_PARAM_NAME, DUAL_FEASIBILITY_TOLERANCE_DEFAULT_VALUE))
                .setPresolveMaxRounds(config.getIntProperty(PRESOLVE_MAX_ROUNDS_PARAM_NAME, MAX_ROUNDS_DEFAULT_VALUE))
                .setPropagationMaxRounds(config.getIntProperty(PROPAGATION_MAX_ROUNDS_PARAM_NAME, MAX_ROUNDS_DEFAULT_VALUE))
                .setPropagationMaxRoundsRoot(config.getIntProperty(PROPAGATION_MAX_ROUNDS_ROOT_PARAM_NAME, MAX_ROUNDS_DEFAULT_VALUE))
                .setSeparationMaxRounds(config.getIntProperty(SEPARATION_MAX_ROUNDS_PARAM_NAME, MAX_ROUNDS_DEFAULT_VALUE))
                .setVerbosity(config.getIntProperty(VERBOSITY_PARAM_NAME, VERBOSITY_DEFAULT_VALUE))
                .setScipExecutable(config.getStringProperty(SCIP_EXECUTABLE_PARAM_NAME, SCIP_EXECUTABLE_DEFAULT_VALUE)));
        return parameters;
    }

    public static MipSolverParameters load(Map<String, String> properties) {
        return new MipSolverParameters().update(properties);
    }

    public MipSolverParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(RELATIVE_GAP_PARAM_NAME))
                .ifPresent(prop -> this.setRelativeGap(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(NODE_LIMIT_PARAM_NAME))
                .ifPresent(prop -> this.setNodeLimit(Long.parseLong(prop)));
        Optional.ofNullable(properties.get(SOLUTION_LIMIT_PARAM_NAME))
                .ifPresent(prop -> this.setSolutionLimit(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(TIME_LIMIT_PARAM_NAME))
                .ifPresent(prop -> this.setTimeLimit(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(FEASIBILITY_TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> this.setFeasibilityTolerance(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(DUAL_FEASIBILITY_TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> this.setDualFeasibilityTolerance(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(PRESOLVE_MAX_ROUNDS_PARAM_NAME))
                .ifPresent(prop -> this.setPresolveMaxRounds(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(PROPAGATION_MAX_ROUNDS_PARAM_NAME))
                .ifPresent(prop -> this.setPropagationMaxRounds(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(PROPAGATION_MAX_ROUNDS_ROOT_PARAM_NAME))
                .ifPresent(prop -> this.setPropagationMaxRoundsRoot(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(SEPARATION_MAX_ROUNDS_PARAM_NAME))
                .ifPresent(prop -> this.setSeparationMaxRounds(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(VERBOSITY_PARAM_NAME))
                .ifPresent(prop -> this.setVerbosity(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(SCIP_EXECUTABLE_PARAM_NAME))
                .ifPresent(this::setScipExecutable);
        return this;
    }

    @Override
    public String toString() {
        return "MipSolverParameters(" + toScipSettings() + ", scipExecutable=" + scipExecutable + ")";
    }
}
