/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.element;

import com.powsybl.openmembrane.material.concrete.BiaxialConcrete;
import com.powsybl.openmembrane.material.concrete.CrackGeometry;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcement;
import com.powsybl.openmembrane.plane.PrincipalStrainState;
import com.powsybl.openmembrane.util.Angles;
import net.jafama.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Limits the average concrete tensile stress to what the reinforcement and the shear on crack surfaces can carry
 * across a crack (Bentz, 2000). The stress is never increased.
 *
 * @author Open Membrane team
 */
public final class CrackCheck {

    private static final Logger LOGGER = LoggerFactory.getLogger(CrackCheck.class);

    public enum Bound {
        /**
         * f1a: the tensile stress from the constitutive law.
         */
        CONSTITUTIVE,
        /**
         * f1b: biaxial yielding of the reinforcement at the crack.
         */
        BIAXIAL_YIELDING,
        /**
         * f1c: equilibrium in x with the maximum shear on crack.
         */
        X_EQUILIBRIUM,
        /**
         * f1d: equilibrium in y with the maximum shear on crack.
         */
        Y_EQUILIBRIUM
    }

    /**
     * @param tensileStress the tensile stress before the check, in MPa
     * @param limitedStress the tensile stress after the check, in MPa
     * @param governing the bound that gave the limited stress
     */
    public record Result(double tensileStress, double limitedStress, Bound governing) {

        public boolean isLimited() {
            return limitedStress < tensileStress;
        }
    }

    private CrackCheck() {
    }

    /**
     * Apply the check to the concrete of the membrane, empty result when the concrete is not cracked.
     */
    public static Optional<Result> apply(Membrane membrane) {
        BiaxialConcrete concrete = membrane.getConcrete();
        if (!concrete.isCracked()) {
            return Optional.empty();
        }
        WebReinforcement reinforcement = membrane.getReinforcement();
        PrincipalStrainState strains = concrete.getPrincipalStrains();
        double theta1 = strains.getTheta1();

        double[] angles = reinforcement.angles(theta1);
        double cosNx = Angles.cos(angles[0]);
        double cosNy = Angles.cos(angles[1]);
        double tanNx = FastMath.abs(Angles.tangent(angles[0]));
        double tanNy = FastMath.abs(Angles.tangent(angles[1]));

        double f1cx = reinforcement.capacityReserveX();
        double f1cy = reinforcement.capacityReserveY();

        double opening = CrackGeometry.opening(CrackGeometry.spacing(theta1, reinforcement), strains.getEpsilon1());
        double vciMax = CrackGeometry.maximumShearOnCrack(concrete.getParameters(), opening);
        double tanSum = tanNx + tanNy;
        if (tanSum > 0) {
            // shear that still allows both layers to yield
            vciMax = Math.min(vciMax, FastMath.abs(f1cx - f1cy) / tanSum);
        }

        double f1a = concrete.getPrincipalStresses().getSigma1();
        double[] bounds = {
            f1a,
            f1cx * cosNx * cosNx + f1cy * cosNy * cosNy,
            f1cx + vciMax * tanNx,
            f1cy + vciMax * tanNy
        };
        int governing = 0;
        for (int i = 1; i < bounds.length; i++) {
            if (bounds[i] < bounds[governing]) {
                governing = i;
            }
        }

        Result result = new Result(f1a, bounds[governing], Bound.values()[governing]);
        if (result.isLimited()) {
            concrete.setTensileStress(result.limitedStress());
            LOGGER.trace("Concrete tensile stress limited from {} to {} MPa ({})", f1a, result.limitedStress(), result.governing());
        }
        return Optional.of(result);
    }
}
