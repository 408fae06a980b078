/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.element;

import com.powsybl.openmembrane.material.concrete.ConcreteParameters;
import com.powsybl.openmembrane.material.concrete.ConstitutiveModel;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcement;
import com.powsybl.openmembrane.plane.MaterialMatrix;
import com.powsybl.openmembrane.plane.PrincipalStrainState;
import com.powsybl.openmembrane.plane.StrainState;
import com.powsybl.openmembrane.plane.StressState;
import com.powsybl.openmembrane.util.PanelExamples;
import org.junit.jupiter.api.Test;

import static com.powsybl.openmembrane.util.MembraneAssert.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Membrane team
 */
class MembraneTest {

    @Test
    void testInitialStiffness() {
        Membrane membrane = PanelExamples.pv10(ConstitutiveModel.MCFT);
        WebReinforcement reinforcement = membrane.getReinforcement();
        MaterialMatrix stiffness = membrane.getInitialStiffness();
        assertEquals(14500 + reinforcement.getRatioX() * 200000, stiffness.get(0, 0), 1E-9);
        assertEquals(14500 + reinforcement.getRatioY() * 200000, stiffness.get(1, 1), 1E-9);
        assertEquals(7250, stiffness.get(2, 2), 1E-9);
        assertEquals(0, stiffness.get(0, 1), 1E-9);
    }

    @Test
    void testUnloaded() {
        for (ConstitutiveModel model : ConstitutiveModel.values()) {
            Membrane membrane = PanelExamples.pv10(model);
            membrane.calculate(StrainState.ZERO);
            assertTrue(membrane.getAverageStresses().isZero(), model.name());
            assertFalse(membrane.isCracked());
            assertEquals(model, membrane.getModel());
        }
    }

    @Test
    void testElasticResponse() {
        Membrane membrane = PanelExamples.pv10(ConstitutiveModel.MCFT);
        membrane.calculate(new StrainState(1E-5, 0, 0));
        double steel = membrane.getReinforcement().getRatioX() * 2;
        assertStressEquals(new StressState(0.145 + steel, 0, 0), membrane.getAverageStresses(), 1E-9);
        assertStrainEquals(new StrainState(1E-5, 0, 0), membrane.getAverageStrains());
        assertEquals(1E-5, membrane.getAveragePrincipalStrains().getEpsilon1(), DELTA_STRAIN);
        assertFalse(membrane.isCracked());
        assertEquals(CrackSlipApproach.NONE, membrane.getCrackSlipApproach());
    }

    @Test
    void testReinforcementIsCopied() {
        WebReinforcement reinforcement = PanelExamples.pv10Reinforcement();
        Membrane membrane = Membrane.create(PanelExamples.pv10Concrete(ConstitutiveModel.MCFT), reinforcement, ConstitutiveModel.MCFT);
        membrane.calculate(new StrainState(1E-3, 1E-3, 0));
        assertNotSame(reinforcement, membrane.getReinforcement());
        assertEquals(0, reinforcement.getStressX());
        assertEquals(200, membrane.getReinforcement().getStressX(), DELTA_STRESS);
    }

    @Test
    void testPlainConcrete() {
        Membrane membrane = PanelExamples.plainConcrete(ConstitutiveModel.MCFT);
        assertEquals(0, membrane.getReinforcement().reinforcedDirectionCount());
        membrane.calculate(new StrainState(-1E-3, 0, 0));
        assertStressEquals(new StressState(-14.5 * 0.75, 0, 0), membrane.getAverageStresses(), 1E-9);
    }

    @Test
    void testCrackedTensionIsLimited() {
        Membrane membrane = PanelExamples.pv10(ConstitutiveModel.MCFT);
        membrane.calculate(new StrainState(0.004, 0.004, 0));
        assertTrue(membrane.isCracked());
        // both layers yielded: the concrete cannot carry tension across the cracks
        assertEquals(0, membrane.getConcrete().getPrincipalStresses().getSigma1(), 1E-12);
        assertEquals(membrane.getReinforcement().getRatioX() * 276, membrane.getAverageStresses().getSigmaX(), 1E-9);
    }

    @Test
    void testDsfmCrackSlip() {
        Membrane membrane = PanelExamples.pv10(ConstitutiveModel.DSFM);
        StrainState strains = new StrainState(0, 0, 0.002);
        membrane.calculate(strains);
        assertTrue(membrane.isCracked());
        assertEquals(CrackSlipApproach.STRESS, membrane.getCrackSlipApproach());
        StrainState slip = membrane.getCrackSlipStrains();
        assertTrue(slip.getEpsilonY() > 0);

        // slip strains of the previous evaluation are removed from the concrete strains
        membrane.calculate(strains);
        assertStrainEquals(strains.subtract(slip), membrane.getConcreteStrains());
    }

    @Test
    void testDsfmWithoutCrackSlip() {
        Membrane membrane = PanelExamples.pv10(ConstitutiveModel.DSFM, false);
        membrane.calculate(new StrainState(0, 0, 0.002));
        assertTrue(membrane.isCracked());
        assertEquals(CrackSlipApproach.NONE, membrane.getCrackSlipApproach());
        assertTrue(membrane.getCrackSlipStrains().isZero());
        assertStrainEquals(new StrainState(0, 0, 0.002), membrane.getConcreteStrains());
    }

    @Test
    void testSmmPoissonEffect() {
        WebReinforcement reinforcement = PanelExamples.pv10Reinforcement();
        PrincipalStrainState strains = new PrincipalStrainState(1E-4, -1E-4, 0.3);
        PrincipalStrainState decoupled = SmmVariant.removePoissonEffect(strains, reinforcement, false);
        double v1 = 1 / 0.96;
        double v2 = 0.2 / 0.96;
        assertEquals(1.041667, v1, 1E-6);
        assertEquals(0.208333, v2, 1E-6);
        assertEquals((v1 - v2) * 1E-4, decoupled.getEpsilon1(), DELTA_STRAIN);
        assertEquals((v2 - v1) * 1E-4, decoupled.getEpsilon2(), DELTA_STRAIN);
        assertEquals(0.3, decoupled.getTheta1());

        // no coupling once cracked
        PrincipalStrainState cracked = SmmVariant.removePoissonEffect(strains, reinforcement, true);
        assertEquals(1E-4, cracked.getEpsilon1(), DELTA_STRAIN);
        assertEquals(-1E-4, cracked.getEpsilon2(), DELTA_STRAIN);
    }

    @Test
    void testSmmPoissonRatio() {
        WebReinforcement reinforcement = PanelExamples.pv10Reinforcement();
        assertEquals(SmmVariant.UNCRACKED_POISSON_RATIO, SmmVariant.poissonRatio12(reinforcement));
        reinforcement.calculate(new StrainState(1E-3, 0, 0));
        assertEquals(0.2 + 0.85, SmmVariant.poissonRatio12(reinforcement), 1E-12);
        reinforcement.calculate(new StrainState(0, 0.002, 0));
        assertEquals(SmmVariant.YIELDED_POISSON_RATIO, SmmVariant.poissonRatio12(reinforcement));
        assertEquals(SmmVariant.UNCRACKED_POISSON_RATIO, SmmVariant.poissonRatio12(WebReinforcement.none()));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(NullPointerException.class, () -> Membrane.create(null, null, ConstitutiveModel.MCFT));
        ConcreteParameters parameters = PanelExamples.pv10Concrete(ConstitutiveModel.MCFT);
        assertThrows(NullPointerException.class, () -> Membrane.create(parameters, null, null));
        Membrane membrane = Membrane.create(parameters, null, ConstitutiveModel.MCFT);
        assertThrows(NullPointerException.class, () -> membrane.calculate(null));
    }
}
