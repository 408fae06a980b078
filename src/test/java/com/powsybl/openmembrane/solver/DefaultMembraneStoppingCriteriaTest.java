/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.solver;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Membrane team
 */
class DefaultMembraneStoppingCriteriaTest {

    @Test
    void testConvergence() {
        assertEquals(25.0 / 5, DefaultMembraneStoppingCriteria.convergence(new double[] {3, 4, 0}, new double[] {0, 0, 2}), 1E-15);
        assertEquals(0, DefaultMembraneStoppingCriteria.convergence(new double[3], new double[3]));
    }

    @Test
    void testScaleConsistency() {
        double[] residual = {1E-3, -2E-3, 5E-4};
        double[] target = {40, -10, 25};
        double convergence = DefaultMembraneStoppingCriteria.convergence(residual, target);
        for (double scale : new double[] {2, 10, 100}) {
            double[] scaledResidual = {residual[0] * scale, residual[1] * scale, residual[2] * scale};
            double[] scaledTarget = {target[0] * scale, target[1] * scale, target[2] * scale};
            assertEquals(convergence, DefaultMembraneStoppingCriteria.convergence(scaledResidual, scaledTarget), convergence * 1E-3);
        }
    }

    @Test
    void testMinIterations() {
        DefaultMembraneStoppingCriteria criteria = new DefaultMembraneStoppingCriteria(1E-3);
        assertEquals(DefaultMembraneStoppingCriteria.DEFAULT_MIN_ITERATIONS, criteria.getMinIterations());
        double[] zero = new double[3];
        MembraneStoppingCriteria.TestResult result = criteria.test(zero, zero, 1);
        assertFalse(result.isStop());
        assertEquals(0, result.getConvergence());
        assertTrue(criteria.test(zero, zero, 2).isStop());
    }

    @Test
    void testTolerance() {
        DefaultMembraneStoppingCriteria criteria = new DefaultMembraneStoppingCriteria(1E-2, 1);
        double[] reference = {0, 0, 1};
        assertTrue(criteria.test(new double[] {0.1, 0, 0}, reference, 1).isStop());
        MembraneStoppingCriteria.TestResult result = criteria.test(new double[] {0.2, 0, 0}, reference, 1);
        assertFalse(result.isStop());
        assertEquals(0.02, result.getConvergence(), 1E-15);
    }

    @Test
    void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultMembraneStoppingCriteria(0));
        assertThrows(IllegalArgumentException.class, () -> new DefaultMembraneStoppingCriteria(1E-3, 0));
    }
}
