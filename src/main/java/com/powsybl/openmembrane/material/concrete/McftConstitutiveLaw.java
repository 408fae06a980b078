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
 * Vecchio and Collins (1986) laws.
 *
 * @author Open Membrane team
 */
public class McftConstitutiveLaw extends AbstractConcreteConstitutiveLaw {

    public McftConstitutiveLaw(ConcreteParameters parameters) {
        super(parameters);
    }

    @Override
    public ConstitutiveModel getModel() {
        return ConstitutiveModel.MCFT;
    }

    @Override
    protected double crackedTensileStress(double strain, double crackAngle) {
        return parameters.getTensileStrength() / (1 + FastMath.sqrt(500 * strain));
    }

    @Override
    public double compressiveStress(double strain, double transverseStrain, boolean cracked) {
        double beta = cracked && transverseStrain > 0 ? softeningFactor(transverseStrain) : 1;
        double peakStrain = parameters.getPlasticStrain();
        return parabola(strain, peakStrain, beta * parameters.getStrength());
    }

    double softeningFactor(double transverseStrain) {
        return Math.min(1, 1 / (0.8 - 0.34 * transverseStrain / parameters.getPlasticStrain()));
    }
}
