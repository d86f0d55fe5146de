/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.util;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.io.table.AsciiTableFormatter;
import com.powsybl.commons.io.table.Column;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Wall clock time of the planning steps (filtering, model build, solve and extraction of each stage).
 *
 * @author Offshore grid planning developers
 */
public class Profiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(Profiler.class);

    public static final Marker PERFORMANCE_MARKER = MarkerFactory.getMarker("PERFORMANCE");

    private final Map<String, Long> elapsedMillis = new LinkedHashMap<>();

    public <T> T run(String taskName, Supplier<T> task) {
        Objects.requireNonNull(taskName);
        Objects.requireNonNull(task);
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            return task.get();
        } finally {
            stopwatch.stop();
            long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
            elapsedMillis.merge(taskName, elapsed, Long::sum);
            LOGGER.debug(PERFORMANCE_MARKER, "Task '{}' done in {} ms", taskName, elapsed);
        }
    }

    public void run(String taskName, Runnable task) {
        run(taskName, () -> {
            task.run();
            return null;
        });
    }

    public Map<String, Long> getElapsedMillis() {
        return elapsedMillis;
    }

    public String formatSummary() {
        StringWriter writer = new StringWriter();
        try (AsciiTableFormatter formatter = new AsciiTableFormatter(writer, "Planning time",
                new Column("Task"),
                new Column("Time (ms)"))) {
            for (Map.Entry<String, Long> e : elapsedMillis.entrySet()) {
                formatter.writeCell(e.getKey())
                        .writeCell(e.getValue().intValue());
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    public void logSummary() {
        if (LOGGER.isInfoEnabled(PERFORMANCE_MARKER)) {
            LOGGER.info(PERFORMANCE_MARKER, "{}{}", System.lineSeparator(), formatSummary());
        }
    }
}
