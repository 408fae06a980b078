/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.plane;

/**
 * Plane stress state (sigmaX, sigmaY, tauXY), in MPa.
 *
 * @author Open Membrane team
 */
public final class StressState extends AbstractPlaneState<StressState> {

    public static final StressState ZERO = new StressState(0, 0, 0);

    public StressState(double sigmaX, double sigmaY, double tauXY) {
        this(sigmaX, sigmaY, tauXY, 0);
    }

    public StressState(double sigmaX, double sigmaY, double tauXY, double thetaX) {
        super(sigmaX, sigmaY, tauXY, thetaX);
    }

    /**
     * Stresses produced by the given strains with the given stiffness (s = K.e).
     */
    public static StressState fromStrains(StrainState strains, MaterialMatrix stiffness) {
        return stiffness.multiply(strains);
    }

    public static StressState fromArray(double[] values) {
        return new StressState(values[0], values[1], values[2]);
    }

    @Override
    protected StressState create(double x, double y, double xy, double thetaX) {
        return new StressState(x, y, xy, thetaX);
    }

    @Override
    protected double shearFactor() {
        return 1;
    }

    public double getSigmaX() {
        return x;
    }

    public double getSigmaY() {
        return y;
    }

    public double getTauXY() {
        return xy;
    }

    public PrincipalStressState toPrincipal() {
        double[] principal = principalComponents();
        return new PrincipalStressState(principal[0], principal[1], principal[2] + thetaX);
    }

    @Override
    public String toString() {
        return format("sigmaX", "sigmaY", "tauXY");
    }
}
