/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.material.concrete;

import com.powsybl.openmembrane.material.reinforcement.WebReinforcement;
import com.powsybl.openmembrane.util.Angles;
import net.jafama.FastMath;

/**
 * Average crack spacing, crack width and shear stress limit on crack surfaces.
 *
 * @author Open Membrane team
 */
public final class CrackGeometry {

    private static final double MIN_OPENING_STRAIN = 1E-9;

    private CrackGeometry() {
    }

    /**
     * Average spacing of cracks whose normal is at {@code theta1} from the x axis, in mm.
     */
    public static double spacing(double theta1, WebReinforcement reinforcement) {
        double sin = FastMath.abs(Angles.sin(theta1));
        double cos = FastMath.abs(Angles.cos(theta1));
        return 1 / (sin / reinforcement.crackSpacingX() + cos / reinforcement.crackSpacingY());
    }

    /**
     * Average crack width, in mm.
     */
    public static double opening(double spacing, double epsilon1) {
        return epsilon1 <= MIN_OPENING_STRAIN ? 0 : spacing * epsilon1;
    }

    /**
     * Maximum shear stress that can be transmitted across a crack of width {@code opening}, in MPa.
     */
    public static double maximumShearOnCrack(ConcreteParameters parameters, double opening) {
        return 0.18 * FastMath.sqrt(parameters.getStrength()) / (0.31 + 24 * opening / (parameters.getAggregateDiameter() + 16));
    }
}
