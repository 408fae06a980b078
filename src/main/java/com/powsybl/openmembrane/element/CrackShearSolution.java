/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.element;

/**
 * Outcome of the local crack equilibrium search.
 *
 * @param found true if the crack strain increment was found
 * @param shearStress shear stress on the crack surface, in MPa, zero when not found
 *
 * @author Open Membrane team
 */
public record CrackShearSolution(boolean found, double shearStress) {

    private static final CrackShearSolution NOT_FOUND = new CrackShearSolution(false, 0);

    public static CrackShearSolution notFound() {
        return NOT_FOUND;
    }

    public static CrackShearSolution of(double shearStress) {
        return new CrackShearSolution(true, shearStress);
    }
}
