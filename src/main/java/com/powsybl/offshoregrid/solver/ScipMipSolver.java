/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.solver;

import com.google.common.base.Stopwatch;
import com.powsybl.offshoregrid.model.LinearModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the SCIP executable on the model written in LP format and reads back its solution file.
 *
 * @author Offshore grid planning developers
 */
public class ScipMipSolver implements MipSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScipMipSolver.class);

    public static final String NAME = "scip";

    /**
     * Extra time given to the process, beyond the solver time limit, to write its files.
     */
    private static final long PROCESS_TIME_MARGIN_SECONDS = 60;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public MipSolverResult solve(LinearModel model, MipSolverParameters parameters, Path logFile) {
        Objects.requireNonNull(model);
        Objects.requireNonNull(parameters);
        Objects.requireNonNull(logFile);

        String baseName = baseName(logFile);
        Path directory = logFile.toAbsolutePath().getParent();
        Path modelFile = directory.resolve(baseName + ".lp");
        Path settingsFile = directory.resolve(baseName + ".set");
        Path solutionFile = directory.resolve(baseName + ".sol");
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(modelFile, StandardCharsets.UTF_8)) {
                new LpFormatWriter(model).write(writer);
            }
            writeSettings(parameters, settingsFile);
            Files.deleteIfExists(solutionFile);

            List<String> command = createCommand(parameters, modelFile, settingsFile, solutionFile, logFile);
            LOGGER.debug("Running {}", command);
            Stopwatch stopwatch = Stopwatch.createStarted();
            Process process = new ProcessBuilder(command)
                    .directory(directory.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            long timeout = (long) Math.ceil(parameters.getTimeLimit()) + PROCESS_TIME_MARGIN_SECONDS;
            if (!process.waitFor(timeout, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new SolverFailureException("SCIP did not terminate within " + timeout + " s");
            }
            LOGGER.debug("SCIP exited with code {} after {} ms", process.exitValue(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
            if (process.exitValue() != 0) {
                throw new SolverFailureException("SCIP exited with code " + process.exitValue() + ", see " + logFile);
            }
            if (!Files.exists(solutionFile)) {
                throw new SolverFailureException("SCIP did not write a solution file, see " + logFile);
            }
            try (BufferedReader reader = Files.newBufferedReader(solutionFile, StandardCharsets.UTF_8)) {
                return ScipSolutionParser.parse(reader, model);
            }
        } catch (IOException e) {
            throw new SolverFailureException("Failed to run SCIP: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverFailureException("Interrupted while waiting for SCIP", e);
        }
    }

    private static String baseName(Path logFile) {
        String fileName = logFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    static void writeSettings(MipSolverParameters parameters, Path settingsFile) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(settingsFile, StandardCharsets.UTF_8)) {
            for (Map.Entry<String, String> e : parameters.toScipSettings().entrySet()) {
                writer.write(e.getKey() + " = " + e.getValue());
                writer.newLine();
            }
        }
    }

    static List<String> createCommand(MipSolverParameters parameters, Path modelFile, Path settingsFile,
                                      Path solutionFile, Path logFile) {
        List<String> command = new ArrayList<>();
        command.add(parameters.getScipExecutable());
        command.add("-q");
        command.add("-s");
        command.add(settingsFile.toString());
        command.add("-l");
        command.add(logFile.toString());
        command.add("-c");
        command.add("read " + quote(modelFile));
        command.add("-c");
        command.add("optimize");
        command.add("-c");
        command.add("write solution " + quote(solutionFile));
        command.add("-c");
        command.add("quit");
        return command;
    }

    /**
     * File names in SCIP shell commands are quoted so that paths with spaces stay one argument.
     */
    private static String quote(Path file) {
        return '"' + file.toString() + '"';
    }
}
