/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Membrane team
 */
class VectorsTest {

    @Test
    void test() {
        double[] a = {3, 4, 0};
        double[] b = {1, 1, 1};
        assertArrayEquals(new double[] {2, 3, -1}, Vectors.minus(a, b));
        assertArrayEquals(new double[] {3, 4, 0}, a);
        assertEquals(25, Vectors.squaredNorm(a));
        assertTrue(Vectors.isFinite(a));
        assertFalse(Vectors.isFinite(new double[] {0, Double.NaN, 0}));
        assertFalse(Vectors.isFinite(new double[] {Double.POSITIVE_INFINITY}));
    }

    @Test
    void testLengthMismatch() {
        double[] a = {1, 2};
        double[] b = {1, 2, 3};
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Vectors.minus(a, b));
        assertEquals("a and b have different length", e.getMessage());
    }
}
