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
import com.powsybl.openmembrane.material.reinforcement.WebReinforcementDirection;
import com.powsybl.openmembrane.plane.StrainState;
import com.powsybl.openmembrane.util.Angles;
import net.jafama.FastMath;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.analysis.solvers.UnivariateSolverUtils;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Shear slip strains along cracks for the disturbed stress field model.
 *
 * @author Open Membrane team
 */
public final class CrackSlip {

    private static final Logger LOGGER = LoggerFactory.getLogger(CrackSlip.class);

    static final double MAX_CRACK_STRAIN_INCREMENT = 0.005;

    static final double FUNCTION_ACCURACY = 1E-9;

    private static final double RELATIVE_ACCURACY = 1E-14;

    private static final double ABSOLUTE_ACCURACY = 1E-12;

    static final int MAX_EVALUATIONS = 1000;

    private static final double SHEAR_TOLERANCE = 1E-9;

    private static final double[] ROTATION_LAG_DEGREES = {10, 7.5, 5};

    /**
     * @param strains slip strains in the x-y frame
     * @param approach the estimate that gave the slip
     * @param crackShear the shear on crack solution the stress based estimate was computed from
     */
    public record Result(StrainState strains, CrackSlipApproach approach, CrackShearSolution crackShear) {
    }

    private CrackSlip() {
    }

    public static Result calculate(Membrane membrane) {
        BiaxialConcrete concrete = membrane.getConcrete();
        CrackShearSolution crackShear = shearOnCrack(membrane);

        double stressSlip = stressBasedSlip(membrane, crackShear.shearStress());
        double rotationLagSlip = rotationLagSlip(membrane);
        double slip = Math.max(stressSlip, rotationLagSlip);

        CrackSlipApproach approach;
        if (slip == 0) {
            approach = CrackSlipApproach.NONE;
        } else {
            approach = stressSlip >= rotationLagSlip ? CrackSlipApproach.STRESS : CrackSlipApproach.ROTATION_LAG;
        }

        double thetaC = concrete.getPrincipalStrains().getTheta1();
        double cos2ThetaC = Angles.cos(2 * thetaC);
        double sin2ThetaC = Angles.sin(2 * thetaC);
        StrainState strains = new StrainState(-0.5 * slip * sin2ThetaC, 0.5 * slip * sin2ThetaC, slip * cos2ThetaC);
        if (membrane.getAverageStrains().getGammaXY() < 0) {
            strains = strains.negate();
        }
        LOGGER.trace("Crack slip: vci={} MPa, stress based={}, rotation lag={}, approach={}", crackShear.shearStress(),
                stressSlip, rotationLagSlip, approach);
        return new Result(strains, approach, crackShear);
    }

    /**
     * Local equilibrium at the crack: find the crack strain increment for which the reinforcement stress increase
     * balances the average concrete tension, then the shear it induces on the crack surface.
     */
    static CrackShearSolution shearOnCrack(Membrane membrane) {
        BiaxialConcrete concrete = membrane.getConcrete();
        WebReinforcement reinforcement = membrane.getReinforcement();
        double[] angles = reinforcement.angles(concrete.getPrincipalStrains().getTheta1());
        LayerAtCrack x = new LayerAtCrack(reinforcement.getX(), angles[0]);
        LayerAtCrack y = new LayerAtCrack(reinforcement.getY(), angles[1]);
        double fc1 = concrete.getPrincipalStresses().getSigma1();

        UnivariateFunction equilibrium = de1 -> x.stressIncrease(de1) * x.cos * x.cos
                + y.stressIncrease(de1) * y.cos * y.cos - fc1;

        if (!UnivariateSolverUtils.isBracketing(equilibrium, 0, MAX_CRACK_STRAIN_INCREMENT)) {
            return CrackShearSolution.notFound();
        }
        double de1;
        try {
            de1 = new BrentSolver(RELATIVE_ACCURACY, ABSOLUTE_ACCURACY, FUNCTION_ACCURACY).solve(MAX_EVALUATIONS, equilibrium, 0, MAX_CRACK_STRAIN_INCREMENT);
        } catch (TooManyEvaluationsException e) {
            LOGGER.debug("Crack equilibrium not found: {}", e.getMessage());
            return CrackShearSolution.notFound();
        }
        return CrackShearSolution.of(x.stressIncrease(de1) * x.cos * x.sin + y.stressIncrease(de1) * y.cos * y.sin);
    }

    /**
     * Walraven (1981) slip from the shear on the crack surface, divided by the crack spacing.
     */
    static double stressBasedSlip(Membrane membrane, double crackShear) {
        double vci = FastMath.abs(crackShear);
        if (vci < SHEAR_TOLERANCE) {
            return 0;
        }
        BiaxialConcrete concrete = membrane.getConcrete();
        double spacing = CrackGeometry.spacing(concrete.getPrincipalStrains().getTheta1(), membrane.getReinforcement());
        double opening = CrackGeometry.opening(spacing, concrete.getPrincipalStrains().getEpsilon1());
        if (opening == 0) {
            return 0;
        }
        double fc = concrete.getParameters().getStrength();
        double a = Math.max(0.234 * FastMath.pow(opening, -0.707) - 0.2, 0);
        double ds = vci / (1.8 * FastMath.pow(opening, -0.8) + a * fc);
        return ds / spacing;
    }

    /**
     * Slip from the difference between the apparent strain field rotation and the lagged stress field rotation.
     */
    static double rotationLagSlip(Membrane membrane) {
        StrainState strains = membrane.getAverageStrains();
        double thetaIc = membrane.getConcrete().getCrackingAngle().orElse(Angles.PI_OVER_4);
        double dThetaE = membrane.getAveragePrincipalStrains().getTheta1() - thetaIc;
        double thetaL = rotationLag(membrane.getReinforcement());
        if (dThetaE < 0) {
            thetaL = -thetaL;
        }
        double dThetaS = FastMath.abs(dThetaE) > FastMath.abs(thetaL) ? dThetaE - thetaL : dThetaE;
        double thetaS = thetaIc + dThetaS;

        return FastMath.abs(strains.getGammaXY() * Angles.cos(2 * thetaS)
                + (strains.getEpsilonY() - strains.getEpsilonX()) * Angles.sin(2 * thetaS));
    }

    static double rotationLag(WebReinforcement reinforcement) {
        return Angles.toRadians(ROTATION_LAG_DEGREES[reinforcement.reinforcedDirectionCount()]);
    }

    private static final class LayerAtCrack {

        private final WebReinforcementDirection direction;

        private final double cos;

        private final double sin;

        private LayerAtCrack(Optional<WebReinforcementDirection> direction, double angle) {
            this.direction = direction.orElse(null);
            this.cos = Angles.cos(angle);
            this.sin = Angles.sin(angle);
        }

        /**
         * Smeared stress increase at the crack for a crack strain increment.
         */
        private double stressIncrease(double de1) {
            if (direction == null) {
                return 0;
            }
            double localStress = direction.stressAt(direction.getStrain() + de1 * cos * cos);
            return direction.getRatio() * (localStress - direction.getStress());
        }
    }
}
