/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.solver;

import com.powsybl.commons.PowsyblException;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Offshore grid planning developers
 */
class MipSolverFactoryTest {

    @Test
    void testFindAll() {
        Set<String> names = MipSolverFactory.findAll().stream().map(MipSolverFactory::getName).collect(Collectors.toSet());
        assertEquals(Set.of(OjAlgoMipSolver.NAME, ScipMipSolver.NAME), names);
    }

    @Test
    void testFind() {
        assertInstanceOf(OjAlgoMipSolver.class, MipSolverFactory.find("ojalgo").create());
        assertInstanceOf(ScipMipSolver.class, MipSolverFactory.find("scip").create());
        PowsyblException e = assertThrows(PowsyblException.class, () -> MipSolverFactory.find("cplex"));
        assertEquals("MIP solver 'cplex' not found", e.getMessage());
    }
}
