/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.plane;

/**
 * Principal strains (epsilon1 &ge; epsilon2 for states extracted from a {@link StrainState}).
 *
 * @author Open Membrane team
 */
public final class PrincipalStrainState extends AbstractPrincipalState<StrainState> {

    public static final PrincipalStrainState ZERO = new PrincipalStrainState(0, 0, 0);

    public PrincipalStrainState(double epsilon1, double epsilon2, double theta1) {
        super(epsilon1, epsilon2, theta1);
    }

    @Override
    protected StrainState createPlaneState(double x, double y, double xy) {
        return new StrainState(x, y, xy);
    }

    @Override
    protected double shearFactor() {
        return 2;
    }

    public double getEpsilon1() {
        return p1;
    }

    public double getEpsilon2() {
        return p2;
    }

    public StrainState toStrainState() {
        return toPlaneState();
    }

    @Override
    public String toString() {
        return format("epsilon1", "epsilon2");
    }
}
