/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.plane;

import com.powsybl.openmembrane.util.Angles;
import com.powsybl.openmembrane.util.Vectors;
import net.jafama.FastMath;

import java.util.Locale;

/**
 * Plane (x, y, xy) state, immutable.
 * <p>
 * Components are stored as given: engineering shear strain for strains, shear stress for stresses.
 * Subclasses only tell how the shear component maps to the tensor shear term.
 *
 * @param <S> the concrete state type
 *
 * @author Open Membrane team
 */
public abstract class AbstractPlaneState<S extends AbstractPlaneState<S>> {

    protected final double x;

    protected final double y;

    protected final double xy;

    protected final double thetaX;

    protected AbstractPlaneState(double x, double y, double xy, double thetaX) {
        this.x = x;
        this.y = y;
        this.xy = xy;
        this.thetaX = thetaX;
    }

    protected abstract S create(double x, double y, double xy, double thetaX);

    /**
     * Ratio between the stored shear component and the tensor shear term (2 for engineering shear strain).
     */
    protected abstract double shearFactor();

    /**
     * Angle of the x axis of this state to the horizontal axis, in radians.
     */
    public double getThetaX() {
        return thetaX;
    }

    public S add(S other) {
        return create(x + other.x, y + other.y, xy + other.xy, thetaX);
    }

    public S subtract(S other) {
        return create(x - other.x, y - other.y, xy - other.xy, thetaX);
    }

    public S multiply(double factor) {
        return create(factor * x, factor * y, factor * xy, thetaX);
    }

    public S negate() {
        return multiply(-1);
    }

    /**
     * Rotate this state by the given angle (counterclockwise, radians).
     */
    public S transform(double angle) {
        if (angle == 0) {
            return create(x, y, xy, thetaX);
        }
        double cos = Angles.cos(angle);
        double sin = Angles.sin(angle);
        double cos2 = cos * cos;
        double sin2 = sin * sin;
        double cosSin = cos * sin;
        double t = xy / shearFactor();

        double xr = x * cos2 + y * sin2 + 2 * t * cosSin;
        double yr = x * sin2 + y * cos2 - 2 * t * cosSin;
        double tr = (y - x) * cosSin + t * (cos2 - sin2);

        return create(xr, yr, tr * shearFactor(), thetaX + angle);
    }

    /**
     * Same state expressed in the horizontal reference (thetaX = 0).
     */
    public S toHorizontal() {
        return thetaX == 0 ? create(x, y, xy, 0) : transform(-thetaX);
    }

    /**
     * Mohr's circle extraction: {p1, p2, theta1}, p1 &ge; p2, theta1 from the x axis of this state to the p1 direction.
     */
    protected double[] principalComponents() {
        double t = xy / shearFactor();
        double center = 0.5 * (x + y);
        double radius = FastMath.sqrt(0.25 * (y - x) * (y - x) + t * t);
        double p1 = center + radius;
        double p2 = center - radius;
        return new double[] {p1, p2, principalAngle(p2, t)};
    }

    private double principalAngle(double p2, double t) {
        if (t == 0) {
            return x >= y ? 0 : Angles.PI_OVER_2;
        }
        if (x == y && t < 0) {
            return -Angles.PI_OVER_4;
        }
        return Angles.PI_OVER_2 - FastMath.atan((x - p2) / t);
    }

    public double[] toArray() {
        return new double[] {x, y, xy};
    }

    public boolean isZero() {
        return x == 0 && y == 0 && xy == 0;
    }

    public boolean isFinite() {
        return Vectors.isFinite(toArray());
    }

    protected String format(String xName, String yName, String xyName) {
        return String.format(Locale.US, "%s(%s=%.6E, %s=%.6E, %s=%.6E, thetaX=%.4f)",
                getClass().getSimpleName(), xName, x, yName, y, xyName, xy, thetaX);
    }
}
