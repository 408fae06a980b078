/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.element;

import com.powsybl.openmembrane.material.concrete.ConstitutiveModel;
import com.powsybl.openmembrane.material.reinforcement.SteelParameters;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcement;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcementDirection;
import com.powsybl.openmembrane.plane.StrainState;
import com.powsybl.openmembrane.util.PanelExamples;
import org.junit.jupiter.api.Test;

import static com.powsybl.openmembrane.util.MembraneAssert.assertStrainEquals;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Membrane team
 */
class CrackSlipTest {

    @Test
    void testRotationLag() {
        assertEquals(Math.toRadians(10), CrackSlip.rotationLag(WebReinforcement.none()), 1E-15);
        WebReinforcement oneLayer = new WebReinforcement(WebReinforcementDirection.create(8, 100, new SteelParameters(400), 100, 0), null);
        assertEquals(Math.toRadians(7.5), CrackSlip.rotationLag(oneLayer), 1E-15);
        assertEquals(Math.toRadians(5), CrackSlip.rotationLag(PanelExamples.pv10Reinforcement()), 1E-15);
    }

    @Test
    void testNoEquilibriumWithoutReinforcement() {
        Membrane membrane = PanelExamples.plainConcrete(ConstitutiveModel.MCFT);
        membrane.calculate(new StrainState(0.001, 0, 0));
        membrane.getConcrete().setTensileStress(0.5);
        CrackShearSolution solution = CrackSlip.shearOnCrack(membrane);
        assertFalse(solution.found());
        assertEquals(0, solution.shearStress());
        assertEquals(0, CrackSlip.stressBasedSlip(membrane, solution.shearStress()));
    }

    @Test
    void testShearOnCrack() {
        Membrane membrane = PanelExamples.pv10(ConstitutiveModel.MCFT);
        membrane.calculate(new StrainState(0, 0, 0.002));
        assertTrue(membrane.isCracked());

        // cracks at 45 degrees: the stiffer x layer carries the difference as shear on the crack
        double fc1 = membrane.getConcrete().getPrincipalStresses().getSigma1();
        double ratioX = membrane.getReinforcement().getRatioX();
        double ratioY = membrane.getReinforcement().getRatioY();
        CrackShearSolution solution = CrackSlip.shearOnCrack(membrane);
        assertTrue(solution.found());
        assertEquals(fc1 * (ratioX - ratioY) / (ratioX + ratioY), solution.shearStress(), 1E-6);
    }

    @Test
    void testStressBasedSlip() {
        Membrane membrane = PanelExamples.pv10(ConstitutiveModel.MCFT);
        membrane.calculate(new StrainState(0, 0, 0.002));

        CrackSlip.Result result = CrackSlip.calculate(membrane);
        assertEquals(CrackSlipApproach.STRESS, result.approach());
        assertTrue(result.crackShear().found());
        StrainState slip = result.strains();
        assertEquals(0, slip.getGammaXY(), 1E-15);
        assertEquals(-slip.getEpsilonY(), slip.getEpsilonX(), 1E-15);
        assertTrue(slip.getEpsilonY() > 0);
        double expected = CrackSlip.stressBasedSlip(membrane, result.crackShear().shearStress());
        assertEquals(expected / 2, slip.getEpsilonY(), 1E-15);
        // no rotation of the strain field since cracking
        assertEquals(0, CrackSlip.rotationLagSlip(membrane), 1E-15);
    }

    @Test
    void testNegativeShear() {
        Membrane membrane = PanelExamples.pv10(ConstitutiveModel.MCFT);
        membrane.calculate(new StrainState(0, 0, -0.002));
        CrackSlip.Result result = CrackSlip.calculate(membrane);
        assertEquals(CrackSlipApproach.STRESS, result.approach());
        assertTrue(result.crackShear().shearStress() < 0);

        // slip strains are oriented by the sign of the shear strain
        Membrane positive = PanelExamples.pv10(ConstitutiveModel.MCFT);
        positive.calculate(new StrainState(0, 0, 0.002));
        assertStrainEquals(CrackSlip.calculate(positive).strains(), result.strains(), 1E-15);
    }

    @Test
    void testRotationLagSlip() {
        Membrane membrane = PanelExamples.pv10(ConstitutiveModel.MCFT);
        membrane.calculate(new StrainState(0, 0, 0.002));
        // strain field rotates by more than the lag after cracking
        membrane.calculate(new StrainState(0.004, 0, 0.002));
        double slip = CrackSlip.rotationLagSlip(membrane);
        assertTrue(slip > 0);
    }
}
