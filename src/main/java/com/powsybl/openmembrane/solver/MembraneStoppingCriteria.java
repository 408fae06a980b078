/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.solver;

/**
 * Convergence test of an iteration.
 *
 * @author Open Membrane team
 */
public interface MembraneStoppingCriteria {

    class TestResult {

        private final boolean stop;

        private final double convergence;

        public TestResult(boolean stop, double convergence) {
            this.stop = stop;
            this.convergence = convergence;
        }

        public boolean isStop() {
            return stop;
        }

        public double getConvergence() {
            return convergence;
        }
    }

    /**
     * @param mismatch the vector that should vanish (stress residual or strain increment)
     * @param reference the vector the mismatch is scaled with (step target or first increment)
     * @param iteration iteration number in the current step, starting at 1
     */
    TestResult test(double[] mismatch, double[] reference, int iteration);
}
