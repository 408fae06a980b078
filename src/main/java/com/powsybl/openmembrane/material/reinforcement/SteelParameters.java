/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.material.reinforcement;

/**
 * Elastic perfectly plastic steel.
 *
 * @param yieldStress yield stress fy, in MPa
 * @param elasticModulus elastic module Es, in MPa
 *
 * @author Open Membrane team
 */
public record SteelParameters(double yieldStress, double elasticModulus) {

    public static final double DEFAULT_ELASTIC_MODULUS = 200000;

    public SteelParameters {
        if (yieldStress <= 0) {
            throw new IllegalArgumentException("Invalid steel yield stress: " + yieldStress);
        }
        if (elasticModulus <= 0) {
            throw new IllegalArgumentException("Invalid steel elastic modulus: " + elasticModulus);
        }
    }

    public SteelParameters(double yieldStress) {
        this(yieldStress, DEFAULT_ELASTIC_MODULUS);
    }

    public double yieldStrain() {
        return yieldStress / elasticModulus;
    }
}
