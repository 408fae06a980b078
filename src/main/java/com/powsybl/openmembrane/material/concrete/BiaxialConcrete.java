/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.material.concrete;

import com.powsybl.openmembrane.plane.MaterialMatrix;
import com.powsybl.openmembrane.plane.PrincipalStrainState;
import com.powsybl.openmembrane.plane.PrincipalStressState;
import com.powsybl.openmembrane.plane.StressState;
import com.powsybl.openmembrane.util.Angles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Concrete under biaxial strain: principal stresses from a constitutive law, crack latch and secant stiffness.
 *
 * @author Open Membrane team
 */
public class BiaxialConcrete {

    private static final Logger LOGGER = LoggerFactory.getLogger(BiaxialConcrete.class);

    private final ConcreteConstitutiveLaw law;

    private boolean cracked = false;

    private double crackingAngle = Double.NaN;

    private PrincipalStrainState principalStrains = PrincipalStrainState.ZERO;

    private PrincipalStressState principalStresses = PrincipalStressState.ZERO;

    public BiaxialConcrete(ConcreteConstitutiveLaw law) {
        this.law = Objects.requireNonNull(law);
    }

    public ConcreteParameters getParameters() {
        return law.getParameters();
    }

    public ConcreteConstitutiveLaw getLaw() {
        return law;
    }

    public boolean isCracked() {
        return cracked;
    }

    /**
     * Angle of the major principal strain when the concrete first cracked, empty while uncracked.
     */
    public OptionalDouble getCrackingAngle() {
        return cracked ? OptionalDouble.of(crackingAngle) : OptionalDouble.empty();
    }

    public PrincipalStrainState getPrincipalStrains() {
        return principalStrains;
    }

    public PrincipalStressState getPrincipalStresses() {
        return principalStresses;
    }

    public void calculate(PrincipalStrainState strains) {
        principalStrains = Objects.requireNonNull(strains);
        double epsilon1 = strains.getEpsilon1();
        double epsilon2 = strains.getEpsilon2();
        double theta1 = strains.getTheta1();

        if (!cracked && epsilon1 > getParameters().getCrackingStrain()) {
            cracked = true;
            crackingAngle = theta1;
            LOGGER.debug("Concrete cracked at epsilon1={}, theta1={} deg", epsilon1, Angles.toDegrees(theta1));
        }

        double sigma1 = epsilon1 > 0
                ? law.tensileStress(epsilon1, theta1)
                : law.compressiveStress(epsilon1, epsilon2, cracked);
        double sigma2 = epsilon2 <= 0
                ? law.compressiveStress(epsilon2, epsilon1, cracked)
                : law.tensileStress(epsilon2, theta1);

        principalStresses = new PrincipalStressState(sigma1, sigma2, theta1);
    }

    /**
     * Replace the major principal stress, used when the tensile stress is limited by the crack check.
     */
    public void setTensileStress(double sigma1) {
        principalStresses = new PrincipalStressState(sigma1, principalStresses.getSigma2(), principalStresses.getTheta1());
    }

    public StressState getStresses() {
        return principalStresses.toStressState();
    }

    public MaterialMatrix getStiffness() {
        double e1 = secantModulus(principalStresses.getSigma1(), principalStrains.getEpsilon1());
        double e2 = secantModulus(principalStresses.getSigma2(), principalStrains.getEpsilon2());
        return MaterialMatrix.fromPrincipal(e1, e2, principalStrains.getTheta1());
    }

    public MaterialMatrix getInitialStiffness() {
        double ec = getParameters().getElasticModulus();
        return MaterialMatrix.fromPrincipal(ec, ec, 0);
    }

    private double secantModulus(double stress, double strain) {
        return strain == 0 ? getParameters().getElasticModulus() : stress / strain;
    }
}
