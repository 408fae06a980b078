/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.material.concrete;

/**
 * Smeared crack theory used for the concrete and the membrane element.
 *
 * @author Open Membrane team
 */
public enum ConstitutiveModel {
    /**
     * Modified Compression Field Theory (Vecchio and Collins, 1986).
     */
    MCFT,
    /**
     * Disturbed Stress Field Model (Vecchio, 2000).
     */
    DSFM,
    /**
     * Softened Membrane Model (Hsu and Zhu, 2002).
     */
    SMM
}
