/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.material.concrete;

import net.jafama.FastMath;

/**
 * Hsu and Zhu (2002) laws.
 *
 * @author Open Membrane team
 */
public class SmmConstitutiveLaw extends AbstractConcreteConstitutiveLaw {

    private static final double MAX_SOFTENING_COEFFICIENT = 0.9;

    public SmmConstitutiveLaw(ConcreteParameters parameters) {
        super(parameters);
    }

    @Override
    public ConstitutiveModel getModel() {
        return ConstitutiveModel.SMM;
    }

    @Override
    protected double crackedTensileStress(double strain, double crackAngle) {
        return parameters.getTensileStrength() * FastMath.pow(parameters.getCrackingStrain() / strain, 0.4);
    }

    @Override
    public double compressiveStress(double strain, double transverseStrain, boolean cracked) {
        if (strain >= 0) {
            return 0;
        }
        double zeta = cracked && transverseStrain > 0 ? softeningCoefficient(transverseStrain) : 1;
        double fc = parameters.getStrength();
        double eta = strain / (zeta * parameters.getPlasticStrain());
        if (eta <= 1) {
            return -zeta * fc * (2 * eta - eta * eta);
        }
        double descending = (eta - 1) / (4 / zeta - 1);
        return Math.min(-zeta * fc * (1 - descending * descending), 0);
    }

    double softeningCoefficient(double transverseStrain) {
        double fc = parameters.getStrength();
        return Math.min(MAX_SOFTENING_COEFFICIENT, 5.8 / FastMath.sqrt(fc) / FastMath.sqrt(1 + 400 * transverseStrain));
    }
}
