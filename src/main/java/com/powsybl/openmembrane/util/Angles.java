/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.util;

import net.jafama.FastMath;

/**
 * Trigonometric helpers that stay finite at 0, 90, 180 and 270 degrees.
 *
 * @author Open Membrane team
 */
public final class Angles {

    /**
     * Cosines and sines below this value are set to exactly zero.
     */
    public static final double ZERO_TOLERANCE = 1E-6;

    /**
     * Value returned by {@link #tangent(double)} where the cosine vanishes.
     */
    public static final double TANGENT_SENTINEL = 1E12;

    public static final double PI_OVER_2 = FastMath.PI / 2;

    public static final double PI_OVER_4 = FastMath.PI / 4;

    private Angles() {
    }

    public static double cos(double angle) {
        return snap(FastMath.cos(angle));
    }

    public static double sin(double angle) {
        return snap(FastMath.sin(angle));
    }

    /**
     * Returns {cos, sin} of the angle, each one snapped to zero below {@link #ZERO_TOLERANCE}.
     */
    public static double[] directionCosines(double angle) {
        return new double[] {cos(angle), sin(angle)};
    }

    /**
     * Tangent of the angle, with a large finite value of the sine sign instead of an infinity.
     */
    public static double tangent(double angle) {
        double cos = cos(angle);
        double sin = sin(angle);
        if (sin == 0) {
            return 0;
        }
        if (cos == 0) {
            return sin > 0 ? TANGENT_SENTINEL : -TANGENT_SENTINEL;
        }
        return sin / cos;
    }

    public static double toDegrees(double angle) {
        return FastMath.toDegrees(angle);
    }

    public static double toRadians(double degrees) {
        return FastMath.toRadians(degrees);
    }

    private static double snap(double value) {
        return Math.abs(value) < ZERO_TOLERANCE ? 0 : value;
    }
}
