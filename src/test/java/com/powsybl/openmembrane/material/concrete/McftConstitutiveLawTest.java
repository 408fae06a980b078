/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.material.concrete;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Membrane team
 */
class McftConstitutiveLawTest {

    private McftConstitutiveLaw law;

    @BeforeEach
    void setUp() {
        law = new McftConstitutiveLaw(ConcreteParameters.create(14.5, 6, ConstitutiveModel.MCFT));
    }

    @Test
    void testTension() {
        assertEquals(ConstitutiveModel.MCFT, law.getModel());
        assertEquals(0, law.tensileStress(-1E-4, 0));
        assertEquals(14500 * 5E-5, law.tensileStress(5E-5, 0), 1E-12);
        double crackingStrain = law.getParameters().getCrackingStrain();
        assertEquals(law.getParameters().getTensileStrength(), law.tensileStress(crackingStrain, 0), 1E-9);
        assertEquals(law.getParameters().getTensileStrength() / 2, law.tensileStress(0.002, 0), 1E-12);
        // tension stiffening decreases with the crack opening
        assertTrue(law.tensileStress(0.004, 0) < law.tensileStress(0.002, 0));
    }

    @Test
    void testCompression() {
        assertEquals(-14.5, law.compressiveStress(-0.002, 0, false), 1E-9);
        assertEquals(-14.5 * 0.75, law.compressiveStress(-0.001, 0, false), 1E-9);
        assertEquals(0, law.compressiveStress(-0.005, 0, false));
        assertEquals(0, law.compressiveStress(0, 0, false));
        // no softening before cracking
        assertEquals(-14.5, law.compressiveStress(-0.002, 0.002, false), 1E-9);
    }

    @Test
    void testCompressionSoftening() {
        assertEquals(1 / 1.14, law.softeningFactor(0.002), 1E-12);
        assertEquals(1, law.softeningFactor(1E-4));
        assertEquals(-14.5 / 1.14, law.compressiveStress(-0.002, 0.002, true), 1E-9);
        assertEquals(-14.5, law.compressiveStress(-0.002, -0.001, true), 1E-9);
    }
}
