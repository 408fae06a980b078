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
import com.powsybl.openmembrane.util.PanelExamples;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Membrane team
 */
class DsfmConstitutiveLawTest {

    private static DsfmConstitutiveLaw createLaw(WebReinforcement reinforcement, boolean considerCrackSlip) {
        return new DsfmConstitutiveLaw(PanelExamples.pv10Concrete(ConstitutiveModel.DSFM), reinforcement, considerCrackSlip);
    }

    @Test
    void testStiffeningCoefficient() {
        DsfmConstitutiveLaw law = createLaw(PanelExamples.pv10Reinforcement(), true);
        assertEquals(157.24, law.stiffeningCoefficient(Angles.PI_OVER_4), 0.05);
        // a crack parallel to the y bars is only crossed by the x bars
        WebReinforcement reinforcement = PanelExamples.pv10Reinforcement();
        double ratioX = reinforcement.getRatioX();
        assertEquals(2.2 / (4 * ratioX / 6.35), law.stiffeningCoefficient(0), 1E-9);

        assertEquals(500, createLaw(WebReinforcement.none(), true).stiffeningCoefficient(Angles.PI_OVER_4));
    }

    @Test
    void testTension() {
        DsfmConstitutiveLaw law = createLaw(WebReinforcement.none(), false);
        ConcreteParameters parameters = law.getParameters();
        assertEquals(ConstitutiveModel.DSFM, law.getModel());
        assertFalse(law.isConsiderCrackSlip());
        assertEquals(14500 * 5E-5, law.tensileStress(5E-5, 0), 1E-12);

        // unreinforced concrete: cracks 21 mm apart, tension softening governs
        double fcr = parameters.getTensileStrength();
        double crackingStrain = parameters.getCrackingStrain();
        double terminalStrain = 2 * parameters.getFractureEnergy() / (fcr * 10.5);
        double expected = fcr * (1 - (0.005 - crackingStrain) / (terminalStrain - crackingStrain));
        assertEquals(expected, law.tensileStress(0.005, 0), 1E-9);
        assertTrue(expected > fcr / (1 + Math.sqrt(500 * 0.005)));

        // past the terminal strain only tension stiffening remains
        assertEquals(fcr / (1 + Math.sqrt(500 * 0.02)), law.tensileStress(0.02, 0), 1E-9);
    }

    @Test
    void testCompressionSoftening() {
        DsfmConstitutiveLaw withSlip = createLaw(PanelExamples.pv10Reinforcement(), true);
        DsfmConstitutiveLaw withoutSlip = createLaw(PanelExamples.pv10Reinforcement(), false);

        double cd = 0.35 * Math.pow(1 - 0.28, 0.8);
        assertEquals(1 / (1 + cd), withoutSlip.softeningFactor(-0.001, 0.001), 1E-12);
        assertEquals(1 / (1 + 0.55 * cd), withSlip.softeningFactor(-0.001, 0.001), 1E-12);
        assertEquals(1, withSlip.softeningFactor(-0.001, 2E-4));
        assertEquals(1, withSlip.softeningFactor(-0.001, -2E-4));

        double betaD = withoutSlip.softeningFactor(-0.001, 0.001);
        double peakStrain = betaD * -0.002;
        assertEquals(-betaD * 14.5, withoutSlip.compressiveStress(peakStrain, 0.001 * betaD * 2, true), 1E-9);
        assertEquals(-14.5, withoutSlip.compressiveStress(-0.002, 0.003, false), 1E-9);
    }
}
