/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.material.concrete;

/**
 * Uniaxial concrete laws in the principal directions. Stresses are negative in compression.
 *
 * @author Open Membrane team
 */
public interface ConcreteConstitutiveLaw {

    ConstitutiveModel getModel();

    ConcreteParameters getParameters();

    /**
     * Stress for a positive principal strain. Concrete is linear up to the cracking strain.
     *
     * @param strain the principal tensile strain
     * @param crackAngle angle of the major principal direction, in radians
     */
    double tensileStress(double strain, double crackAngle);

    /**
     * Stress for a non positive principal strain.
     *
     * @param strain the principal compressive strain
     * @param transverseStrain the other principal strain, softening the concrete when tensile
     * @param cracked true if the concrete has cracked
     */
    double compressiveStress(double strain, double transverseStrain, boolean cracked);
}
