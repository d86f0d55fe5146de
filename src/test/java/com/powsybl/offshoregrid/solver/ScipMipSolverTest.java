/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.solver;

import com.powsybl.offshoregrid.model.ConstraintSense;
import com.powsybl.offshoregrid.model.LinearModel;
import com.powsybl.offshoregrid.model.ModelVariable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Offshore grid planning developers
 */
class ScipMipSolverTest {

    @TempDir
    Path directory;

    @Test
    void testCommand() {
        MipSolverParameters parameters = new MipSolverParameters().setScipExecutable("/opt/scip/bin/scip");
        List<String> command = ScipMipSolver.createCommand(parameters, Path.of("/tmp/m.lp"), Path.of("/tmp/m.set"),
                Path.of("/tmp/m.sol"), Path.of("/tmp/m.txt"));
        assertEquals(List.of("/opt/scip/bin/scip", "-q", "-s", "/tmp/m.set", "-l", "/tmp/m.txt",
                "-c", "read \"/tmp/m.lp\"", "-c", "optimize", "-c", "write solution \"/tmp/m.sol\"", "-c", "quit"), command);
    }

    @Test
    void testCommandWithSpacesInPaths() {
        Path runDirectory = Path.of("/home/planner/Offshore grid/results");
        List<String> command = ScipMipSolver.createCommand(new MipSolverParameters(), runDirectory.resolve("r 2040.lp"),
                runDirectory.resolve("r 2040.set"), runDirectory.resolve("r 2040.sol"), runDirectory.resolve("r 2040.txt"));
        assertEquals("read \"/home/planner/Offshore grid/results/r 2040.lp\"", command.get(7));
        assertEquals("write solution \"/home/planner/Offshore grid/results/r 2040.sol\"", command.get(11));
        // process arguments are passed as is
        assertEquals("/home/planner/Offshore grid/results/r 2040.set", command.get(3));
    }

    @Test
    void testSettings() throws IOException {
        Path settingsFile = directory.resolve("scip.set");
        ScipMipSolver.writeSettings(new MipSolverParameters().setNodeLimit(50), settingsFile);
        List<String> lines = Files.readAllLines(settingsFile);
        assertEquals(11, lines.size());
        assertTrue(lines.contains("limits/nodes = 50"));
        assertTrue(lines.contains("numerics/feastol = 1.0E-5"));
    }

    @Test
    void testMissingExecutable() {
        LinearModel model = new LinearModel();
        ModelVariable x = model.addContinuousVariable("x", 0, 1).setObjectiveCoefficient(1);
        model.addConstraint("c", ConstraintSense.GREATER_OR_EQUAL, 0).addTerm(x, 1);
        MipSolverParameters parameters = new MipSolverParameters()
                .setScipExecutable(directory.resolve("no-such-scip").toString());
        Path logFile = directory.resolve("r_solverlog_2040.txt");

        SolverFailureException e = assertThrows(SolverFailureException.class,
            () -> new ScipMipSolver().solve(model, parameters, logFile));
        assertTrue(e.getMessage().startsWith("Failed to run SCIP"));
        // the model is written before the solver is started
        assertTrue(Files.exists(directory.resolve("r_solverlog_2040.lp")));
        assertTrue(Files.exists(directory.resolve("r_solverlog_2040.set")));
    }
}
