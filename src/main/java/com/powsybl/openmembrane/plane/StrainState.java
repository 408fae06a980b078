/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.plane;

/**
 * Plane strain state (epsilonX, epsilonY, gammaXY), gammaXY being the engineering shear strain.
 *
 * @author Open Membrane team
 */
public final class StrainState extends AbstractPlaneState<StrainState> {

    public static final StrainState ZERO = new StrainState(0, 0, 0);

    public StrainState(double epsilonX, double epsilonY, double gammaXY) {
        this(epsilonX, epsilonY, gammaXY, 0);
    }

    public StrainState(double epsilonX, double epsilonY, double gammaXY, double thetaX) {
        super(epsilonX, epsilonY, gammaXY, thetaX);
    }

    /**
     * Strains that produce the given stresses with the given stiffness (K.e = s).
     */
    public static StrainState fromStresses(StressState stresses, MaterialMatrix stiffness) {
        return stiffness.solve(stresses);
    }

    public static StrainState fromArray(double[] values) {
        return new StrainState(values[0], values[1], values[2]);
    }

    @Override
    protected StrainState create(double x, double y, double xy, double thetaX) {
        return new StrainState(x, y, xy, thetaX);
    }

    @Override
    protected double shearFactor() {
        return 2;
    }

    public double getEpsilonX() {
        return x;
    }

    public double getEpsilonY() {
        return y;
    }

    public double getGammaXY() {
        return xy;
    }

    public PrincipalStrainState toPrincipal() {
        double[] principal = principalComponents();
        return new PrincipalStrainState(principal[0], principal[1], principal[2] + thetaX);
    }

    @Override
    public String toString() {
        return format("epsilonX", "epsilonY", "gammaXY");
    }
}
