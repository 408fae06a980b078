/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.solver;

import com.powsybl.openmembrane.util.Vectors;

/**
 * Stop when |mismatch|^2 / (1 + |reference|^2) is below the tolerance, after a minimum number of iterations.
 *
 * @author Open Membrane team
 */
public class DefaultMembraneStoppingCriteria implements MembraneStoppingCriteria {

    public static final int DEFAULT_MIN_ITERATIONS = 2;

    private final double tolerance;

    private final int minIterations;

    public DefaultMembraneStoppingCriteria(double tolerance) {
        this(tolerance, DEFAULT_MIN_ITERATIONS);
    }

    public DefaultMembraneStoppingCriteria(double tolerance, int minIterations) {
        if (tolerance <= 0) {
            throw new IllegalArgumentException("Invalid tolerance: " + tolerance);
        }
        if (minIterations < 1) {
            throw new IllegalArgumentException("Invalid min iterations: " + minIterations);
        }
        this.tolerance = tolerance;
        this.minIterations = minIterations;
    }

    public double getTolerance() {
        return tolerance;
    }

    public int getMinIterations() {
        return minIterations;
    }

    public static double convergence(double[] mismatch, double[] reference) {
        return Vectors.squaredNorm(mismatch) / (1 + Vectors.squaredNorm(reference));
    }

    @Override
    public TestResult test(double[] mismatch, double[] reference, int iteration) {
        double convergence = convergence(mismatch, reference);
        return new TestResult(iteration >= minIterations && convergence <= tolerance, convergence);
    }
}
