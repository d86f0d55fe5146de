/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.model;

/**
 * @author Offshore grid planning developers
 */
public enum ConstraintSense {
    LESS_OR_EQUAL,
    GREATER_OR_EQUAL,
    EQUAL
}
