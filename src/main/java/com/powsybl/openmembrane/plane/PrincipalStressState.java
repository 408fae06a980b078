/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.plane;

/**
 * Principal stresses in MPa.
 *
 * @author Open Membrane team
 */
public final class PrincipalStressState extends AbstractPrincipalState<StressState> {

    public static final PrincipalStressState ZERO = new PrincipalStressState(0, 0, 0);

    public PrincipalStressState(double sigma1, double sigma2, double theta1) {
        super(sigma1, sigma2, theta1);
    }

    @Override
    protected StressState createPlaneState(double x, double y, double xy) {
        return new StressState(x, y, xy);
    }

    @Override
    protected double shearFactor() {
        return 1;
    }

    public double getSigma1() {
        return p1;
    }

    public double getSigma2() {
        return p2;
    }

    public StressState toStressState() {
        return toPlaneState();
    }

    @Override
    public String toString() {
        return format("sigma1", "sigma2");
    }
}
