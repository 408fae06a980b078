/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.solver;

/**
 * Rank one update applied to the solver stiffness between two iterations.
 *
 * @author Open Membrane team
 */
public enum StiffnessUpdateMode {
    /**
     * Broyden update: the new stiffness maps the last strain increment to the last residual change. The unbalanced
     * residual change is divided by the squared norm of the strain increment, not by its norm, so that the updated
     * stiffness satisfies K.de = dr exactly.
     */
    SECANT,
    /**
     * Outer product of the last stress and strain changes added to the current stiffness.
     */
    NEWTON_RAPHSON
}
