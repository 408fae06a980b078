/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.solver;

import com.powsybl.openmembrane.element.CrackSlipApproach;
import com.powsybl.openmembrane.element.Membrane;
import com.powsybl.openmembrane.plane.MaterialMatrix;
import com.powsybl.openmembrane.plane.PrincipalStrainState;
import com.powsybl.openmembrane.plane.PrincipalStressState;
import com.powsybl.openmembrane.plane.StrainState;
import com.powsybl.openmembrane.plane.StressState;
import com.powsybl.openmembrane.util.Angles;

import java.util.Objects;

/**
 * Converged state of one load step.
 *
 * @author Open Membrane team
 */
public class StepResult {

    private final int step;

    private final int iterations;

    private final StressState targetStresses;

    private final StrainState averageStrains;

    private final StressState averageStresses;

    private final PrincipalStrainState averagePrincipalStrains;

    private final PrincipalStrainState concretePrincipalStrains;

    private final PrincipalStressState concretePrincipalStresses;

    private final MaterialMatrix stiffness;

    private final StrainState crackSlipStrains;

    private final CrackSlipApproach crackSlipApproach;

    private final boolean cracked;

    StepResult(int step, int iterations, StressState targetStresses, Membrane membrane, MaterialMatrix stiffness) {
        this.step = step;
        this.iterations = iterations;
        this.targetStresses = Objects.requireNonNull(targetStresses);
        this.averageStrains = membrane.getAverageStrains();
        this.averageStresses = membrane.getAverageStresses();
        this.averagePrincipalStrains = membrane.getAveragePrincipalStrains();
        this.concretePrincipalStrains = membrane.getConcrete().getPrincipalStrains();
        this.concretePrincipalStresses = membrane.getConcrete().getPrincipalStresses();
        this.stiffness = stiffness.copy();
        this.crackSlipStrains = membrane.getCrackSlipStrains();
        this.crackSlipApproach = membrane.getCrackSlipApproach();
        this.cracked = membrane.isCracked();
    }

    public int getStep() {
        return step;
    }

    public int getIterations() {
        return iterations;
    }

    public StressState getTargetStresses() {
        return targetStresses;
    }

    public StrainState getAverageStrains() {
        return averageStrains;
    }

    public StressState getAverageStresses() {
        return averageStresses;
    }

    public PrincipalStrainState getAveragePrincipalStrains() {
        return averagePrincipalStrains;
    }

    public PrincipalStrainState getConcretePrincipalStrains() {
        return concretePrincipalStrains;
    }

    public PrincipalStressState getConcretePrincipalStresses() {
        return concretePrincipalStresses;
    }

    public MaterialMatrix getStiffness() {
        return stiffness.copy();
    }

    public StrainState getCrackSlipStrains() {
        return crackSlipStrains;
    }

    public CrackSlipApproach getCrackSlipApproach() {
        return crackSlipApproach;
    }

    public boolean isCracked() {
        return cracked;
    }

    /**
     * Angle of the average principal tensile strain, in degrees.
     */
    public double getStrainAngle() {
        return Angles.toDegrees(averagePrincipalStrains.getTheta1());
    }

    /**
     * Angle of the concrete principal tensile stress, in degrees.
     */
    public double getStressAngle() {
        return Angles.toDegrees(concretePrincipalStresses.getTheta1());
    }
}
