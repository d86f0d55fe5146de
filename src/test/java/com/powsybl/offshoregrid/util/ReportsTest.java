/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.util;

import com.powsybl.commons.report.ReportNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Offshore grid planning developers
 */
class ReportsTest {

    @Test
    void testStageReports() {
        ReportNode root = Reports.createRootReportNode("r_sf_d_in");
        assertEquals("Offshore grid planning r_sf_d_in", root.getMessage());

        Reports.reportViableNetwork(root, 3, 1, 2, 9);
        Reports.reportModelSize(root, 40, 31);
        ReportNode stage = Reports.createStageReportNode(root, 2030);
        Reports.reportStageSolved(stage, 2030, "OPTIMAL", 12.5);
        Reports.reportStageFailed(Reports.createStageReportNode(root, 2040), 2040, "INFEASIBLE", "infeasible");
        Reports.reportStagesSkipped(root, 1);

        assertEquals(5, root.getChildren().size());
        assertEquals("Viable network: 3 wind farms, 1 energy hubs, 2 onshore substations, 9 connections",
                root.getChildren().get(0).getMessage());
        assertEquals("Model has 40 variables and 31 constraints", root.getChildren().get(1).getMessage());
        assertEquals("Stage 2030", stage.getMessage());
        assertEquals("Stage 2030 solved (OPTIMAL), cost of built assets 12.5 M€", stage.getChildren().get(0).getMessage());

        ReportNode failed = root.getChildren().get(3).getChildren().get(0);
        assertEquals("offshoreGrid.stageFailed", failed.getMessageKey());
        assertEquals("Stage 2040 has no solution (INFEASIBLE: infeasible)", failed.getMessage());
        assertEquals("1 remaining stage(s) skipped", root.getChildren().get(4).getMessage());
    }

    @Test
    void testLimitReached() {
        ReportNode stage = Reports.createStageReportNode(ReportNode.newRootReportNode().withMessageTemplate("root", "Root").build(), 2050);
        Reports.reportLimitReached(stage, 2050, "time limit");
        assertEquals("Stage 2050: solver stopped on a limit (time limit), solution may not be optimal",
                stage.getChildren().get(0).getMessage());
    }
}
