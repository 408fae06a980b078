/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.util;

/**
 * Small helpers on the 3 component arrays (x, y, xy) used by plane states.
 *
 * @author Open Membrane team
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * a - b
     */
    public static double[] minus(double[] a, double[] b) {
        checkLength(a, b);
        double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = a[i] - b[i];
        }
        return result;
    }

    public static double squaredNorm(double[] vector) {
        double norm = 0;
        for (double v : vector) {
            norm += v * v;
        }
        return norm;
    }

    public static boolean isFinite(double[] vector) {
        for (double v : vector) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    private static void checkLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("a and b have different length");
        }
    }
}
