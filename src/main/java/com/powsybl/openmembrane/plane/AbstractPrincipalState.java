/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.plane;

import com.powsybl.openmembrane.util.Angles;

import java.util.Locale;

/**
 * Principal values of a plane state: major value p1, minor value p2 and angle theta1 from the horizontal axis to
 * the major direction, in radians.
 *
 * @param <S> the plane state type this principal state is extracted from
 *
 * @author Open Membrane team
 */
public abstract class AbstractPrincipalState<S extends AbstractPlaneState<S>> {

    protected final double p1;

    protected final double p2;

    protected final double theta1;

    protected AbstractPrincipalState(double p1, double p2, double theta1) {
        this.p1 = p1;
        this.p2 = p2;
        this.theta1 = theta1;
    }

    protected abstract S createPlaneState(double x, double y, double xy);

    protected abstract double shearFactor();

    public double getTheta1() {
        return theta1;
    }

    public double getTheta2() {
        return theta1 + Angles.PI_OVER_2;
    }

    /**
     * Inverse rotation by theta1: the state in the horizontal reference frame.
     */
    public S toPlaneState() {
        double cos = Angles.cos(theta1);
        double sin = Angles.sin(theta1);
        double cos2 = cos * cos;
        double sin2 = sin * sin;
        double cosSin = cos * sin;
        return createPlaneState(p1 * cos2 + p2 * sin2,
                                p1 * sin2 + p2 * cos2,
                                shearFactor() * cosSin * (p1 - p2));
    }

    protected String format(String p1Name, String p2Name) {
        return String.format(Locale.US, "%s(%s=%.6E, %s=%.6E, theta1=%.4f)",
                getClass().getSimpleName(), p1Name, p1, p2Name, p2, theta1);
    }
}
