/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.solver;

import com.powsybl.openmembrane.plane.MaterialMatrix;
import com.powsybl.openmembrane.plane.StrainState;
import com.powsybl.openmembrane.plane.StressState;

/**
 * State of one solver iteration.
 *
 * @param strains strains the element was evaluated at
 * @param stresses element stresses at these strains
 * @param residual stresses minus the step target
 * @param stiffness solver stiffness used to compute the next increment
 *
 * @author Open Membrane team
 */
public record IterationRecord(StrainState strains, StressState stresses, StressState residual, MaterialMatrix stiffness) {
}
