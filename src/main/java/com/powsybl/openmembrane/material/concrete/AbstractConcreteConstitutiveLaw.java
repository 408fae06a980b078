/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.material.concrete;

import java.util.Objects;

/**
 * Linear uncracked tension and Hognestad parabola shared by the three models.
 *
 * @author Open Membrane team
 */
public abstract class AbstractConcreteConstitutiveLaw implements ConcreteConstitutiveLaw {

    protected final ConcreteParameters parameters;

    protected AbstractConcreteConstitutiveLaw(ConcreteParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    @Override
    public ConcreteParameters getParameters() {
        return parameters;
    }

    @Override
    public double tensileStress(double strain, double crackAngle) {
        if (strain <= 0) {
            return 0;
        }
        if (strain <= parameters.getCrackingStrain()) {
            return parameters.getElasticModulus() * strain;
        }
        return crackedTensileStress(strain, crackAngle);
    }

    protected abstract double crackedTensileStress(double strain, double crackAngle);

    /**
     * Parabola reaching -peakStress at peakStrain and zero at twice peakStrain, zero beyond.
     */
    protected static double parabola(double strain, double peakStrain, double peakStress) {
        if (strain >= 0) {
            return 0;
        }
        double eta = strain / peakStrain;
        if (eta > 2) {
            return 0;
        }
        return -peakStress * (2 * eta - eta * eta);
    }
}
