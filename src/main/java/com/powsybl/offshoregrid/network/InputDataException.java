/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.offshoregrid.network;

import com.powsybl.commons.PowsyblException;

/**
 * Thrown when wind farm, energy hub or substation data cannot be used to build a model.
 *
 * @author Offshore grid planning developers
 */
public class InputDataException extends PowsyblException {

    public InputDataException(String message) {
        super(message);
    }
}
