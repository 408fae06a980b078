/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.util;

import com.powsybl.openmembrane.plane.MaterialMatrix;
import com.powsybl.openmembrane.plane.StrainState;
import com.powsybl.openmembrane.plane.StressState;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * @author Open Membrane team
 */
public final class MembraneAssert {

    public static final double DELTA_STRAIN = 1E-12;
    public static final double DELTA_STRESS = 1E-6;
    public static final double DELTA_ANGLE = 1E-9;

    private MembraneAssert() {
    }

    public static void assertStrainEquals(StrainState expected, StrainState actual) {
        assertStrainEquals(expected, actual, DELTA_STRAIN);
    }

    public static void assertStrainEquals(StrainState expected, StrainState actual, double delta) {
        assertEquals(expected.getEpsilonX(), actual.getEpsilonX(), delta, "epsilonX");
        assertEquals(expected.getEpsilonY(), actual.getEpsilonY(), delta, "epsilonY");
        assertEquals(expected.getGammaXY(), actual.getGammaXY(), delta, "gammaXY");
    }

    public static void assertStressEquals(StressState expected, StressState actual) {
        assertStressEquals(expected, actual, DELTA_STRESS);
    }

    public static void assertStressEquals(StressState expected, StressState actual, double delta) {
        assertEquals(expected.getSigmaX(), actual.getSigmaX(), delta, "sigmaX");
        assertEquals(expected.getSigmaY(), actual.getSigmaY(), delta, "sigmaY");
        assertEquals(expected.getTauXY(), actual.getTauXY(), delta, "tauXY");
    }

    public static void assertMatrixEquals(double[][] expected, MaterialMatrix actual, double delta) {
        for (int i = 0; i < MaterialMatrix.SIZE; i++) {
            for (int j = 0; j < MaterialMatrix.SIZE; j++) {
                assertEquals(expected[i][j], actual.get(i, j), delta, "m(" + i + ", " + j + ")");
            }
        }
    }
}
