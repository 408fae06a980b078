/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.material.concrete;

import com.powsybl.openmembrane.material.reinforcement.WebReinforcement;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcementDirection;
import com.powsybl.openmembrane.util.Angles;
import net.jafama.FastMath;

import java.util.Objects;
import java.util.Optional;

/**
 * Vecchio (2000) laws: tension stiffening bounded by tension softening and compression softening depending on the
 * strain ratio.
 *
 * @author Open Membrane team
 */
public class DsfmConstitutiveLaw extends AbstractConcreteConstitutiveLaw {

    private static final double UNREINFORCED_STIFFENING_COEFFICIENT = 500;

    private static final double SLIP_SOFTENING_COEFFICIENT = 0.55;

    private final WebReinforcement reinforcement;

    private final boolean considerCrackSlip;

    public DsfmConstitutiveLaw(ConcreteParameters parameters, WebReinforcement reinforcement, boolean considerCrackSlip) {
        super(parameters);
        this.reinforcement = Objects.requireNonNull(reinforcement);
        this.considerCrackSlip = considerCrackSlip;
    }

    @Override
    public ConstitutiveModel getModel() {
        return ConstitutiveModel.DSFM;
    }

    public boolean isConsiderCrackSlip() {
        return considerCrackSlip;
    }

    @Override
    protected double crackedTensileStress(double strain, double crackAngle) {
        double fcr = parameters.getTensileStrength();
        double stiffening = fcr / (1 + FastMath.sqrt(stiffeningCoefficient(crackAngle) * strain));

        double crackingStrain = parameters.getCrackingStrain();
        double referenceLength = 0.5 * CrackGeometry.spacing(crackAngle, reinforcement);
        double terminalStrain = 2 * parameters.getFractureEnergy() / (fcr * referenceLength);
        double softening = terminalStrain > crackingStrain
                ? Math.max(fcr * (1 - (strain - crackingStrain) / (terminalStrain - crackingStrain)), 0)
                : 0;

        return Math.max(stiffening, softening);
    }

    /**
     * ct = 2.2 m, with 1/m the sum over the layers of 4 rho / phi |cos thetaN|.
     */
    double stiffeningCoefficient(double crackAngle) {
        double[] angles = reinforcement.angles(crackAngle);
        double inverseM = layerTerm(reinforcement.getX(), angles[0]) + layerTerm(reinforcement.getY(), angles[1]);
        return inverseM > 0 ? 2.2 / inverseM : UNREINFORCED_STIFFENING_COEFFICIENT;
    }

    private static double layerTerm(Optional<WebReinforcementDirection> direction, double angle) {
        return direction.filter(d -> d.getRatio() > 0)
                .map(d -> 4 * d.getRatio() / d.getDiameter() * FastMath.abs(Angles.cos(angle)))
                .orElse(0.0);
    }

    @Override
    public double compressiveStress(double strain, double transverseStrain, boolean cracked) {
        double betaD = cracked ? softeningFactor(strain, transverseStrain) : 1;
        return parabola(strain, betaD * parameters.getPlasticStrain(), betaD * parameters.getStrength());
    }

    double softeningFactor(double strain, double transverseStrain) {
        if (strain >= 0 || transverseStrain <= 0) {
            return 1;
        }
        double ratio = -transverseStrain / strain;
        double cd = ratio > 0.28 ? 0.35 * FastMath.pow(ratio - 0.28, 0.8) : 0;
        double cs = considerCrackSlip ? SLIP_SOFTENING_COEFFICIENT : 1;
        return Math.min(1, 1 / (1 + cs * cd));
    }
}
