/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.util;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;

/**
 * Functional report entries of a planning run.
 *
 * @author Offshore grid planning developers
 */
public final class Reports {

    private static final String YEAR = "year";
    private static final String STATUS = "status";
    private static final String TERMINATION = "termination";

    private Reports() {
    }

    public static ReportNode createRootReportNode(String filePrefix) {
        return ReportNode.newRootReportNode()
                .withMessageTemplate("offshoreGrid.planning", "Offshore grid planning ${filePrefix}")
                .withUntypedValue("filePrefix", filePrefix)
                .build();
    }

    public static void reportViableNetwork(ReportNode reportNode, int windFarmCount, int hubCount, int substationCount,
                                           int connectionCount) {
        reportNode.newReportNode()
                .withMessageTemplate("offshoreGrid.viableNetwork",
                        "Viable network: ${windFarmCount} wind farms, ${hubCount} energy hubs, ${substationCount} onshore substations, ${connectionCount} connections")
                .withUntypedValue("windFarmCount", windFarmCount)
                .withUntypedValue("hubCount", hubCount)
                .withUntypedValue("substationCount", substationCount)
                .withUntypedValue("connectionCount", connectionCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportModelSize(ReportNode reportNode, int variableCount, int constraintCount) {
        reportNode.newReportNode()
                .withMessageTemplate("offshoreGrid.modelSize", "Model has ${variableCount} variables and ${constraintCount} constraints")
                .withUntypedValue("variableCount", variableCount)
                .withUntypedValue("constraintCount", constraintCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static ReportNode createStageReportNode(ReportNode reportNode, int year) {
        return reportNode.newReportNode()
                .withMessageTemplate("offshoreGrid.stage", "Stage ${year}")
                .withUntypedValue(YEAR, year)
                .add();
    }

    public static void reportStageSolved(ReportNode reportNode, int year, String status, double totalCost) {
        reportNode.newReportNode()
                .withMessageTemplate("offshoreGrid.stageSolved", "Stage ${year} solved (${status}), cost of built assets ${totalCost} M€")
                .withUntypedValue(YEAR, year)
                .withUntypedValue(STATUS, status)
                .withUntypedValue("totalCost", totalCost)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportLimitReached(ReportNode reportNode, int year, String termination) {
        reportNode.newReportNode()
                .withMessageTemplate("offshoreGrid.limitReached", "Stage ${year}: solver stopped on a limit (${termination}), solution may not be optimal")
                .withUntypedValue(YEAR, year)
                .withUntypedValue(TERMINATION, termination)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportStageFailed(ReportNode reportNode, int year, String status, String termination) {
        reportNode.newReportNode()
                .withMessageTemplate("offshoreGrid.stageFailed", "Stage ${year} has no solution (${status}: ${termination})")
                .withUntypedValue(YEAR, year)
                .withUntypedValue(STATUS, status)
                .withUntypedValue(TERMINATION, termination)
                .withSeverity(TypedValue.ERROR_SEVERITY)
                .add();
    }

    public static void reportStagesSkipped(ReportNode reportNode, int skippedCount) {
        reportNode.newReportNode()
                .withMessageTemplate("offshoreGrid.stagesSkipped", "${skippedCount} remaining stage(s) skipped")
                .withUntypedValue("skippedCount", skippedCount)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }
}
