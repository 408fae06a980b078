/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.element;

/**
 * Approach that governed the last crack slip computation.
 *
 * @author Open Membrane team
 */
public enum CrackSlipApproach {
    /**
     * No slip: uncracked concrete or both estimates are zero.
     */
    NONE,
    /**
     * Stress based estimate from the shear on the crack surface (Walraven).
     */
    STRESS,
    /**
     * Estimate from the lag between stress and strain field rotations.
     */
    ROTATION_LAG
}
