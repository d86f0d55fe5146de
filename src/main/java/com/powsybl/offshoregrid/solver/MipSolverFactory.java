/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.solver;

import com.google.common.collect.Lists;
import com.powsybl.commons.PowsyblException;

import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * @author Offshore grid planning developers
 */
public interface MipSolverFactory {

    static List<MipSolverFactory> findAll() {
        return Lists.newArrayList(ServiceLoader.load(MipSolverFactory.class, MipSolverFactory.class.getClassLoader()).iterator());
    }

    static MipSolverFactory find(String name) {
        Objects.requireNonNull(name);
        return findAll().stream().filter(f -> name.equals(f.getName()))
                .findFirst().orElseThrow(() -> new PowsyblException("MIP solver '" + name + "' not found"));
    }

    String getName();

    MipSolver create();
}
