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

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * @author Open Membrane team
 */
public class MembraneSolverResult {

    private final MembraneSolverStatus status;

    private final List<StepResult> steps;

    private final StressState crackingStresses;

    private final int crackingStep;

    private final int failedStep;

    private final int calculationCount;

    private final MaterialMatrix stiffness;

    MembraneSolverResult(MembraneSolverStatus status, List<StepResult> steps, StressState crackingStresses,
                         int crackingStep, int failedStep, int calculationCount, MaterialMatrix stiffness) {
        if (calculationCount < 0) {
            throw new IllegalArgumentException("Invalid calculation count: " + calculationCount);
        }
        this.status = Objects.requireNonNull(status);
        this.steps = List.copyOf(steps);
        this.crackingStresses = crackingStresses;
        this.crackingStep = crackingStep;
        this.failedStep = failedStep;
        this.calculationCount = calculationCount;
        this.stiffness = Objects.requireNonNull(stiffness).copy();
    }

    public MembraneSolverStatus getStatus() {
        return status;
    }

    public boolean isConverged() {
        return status == MembraneSolverStatus.CONVERGED;
    }

    /**
     * Converged steps, in order.
     */
    public List<StepResult> getSteps() {
        return steps;
    }

    public Optional<StepResult> getLastStep() {
        return steps.isEmpty() ? Optional.empty() : Optional.of(steps.get(steps.size() - 1));
    }

    /**
     * Stresses of the first converged step with cracked concrete.
     */
    public Optional<StressState> getCrackingStresses() {
        return Optional.ofNullable(crackingStresses);
    }

    public OptionalInt getCrackingStep() {
        return crackingStep > 0 ? OptionalInt.of(crackingStep) : OptionalInt.empty();
    }

    /**
     * Stresses of the last converged step, zero if no step converged.
     */
    public StressState getUltimateStresses() {
        return getLastStep().map(StepResult::getAverageStresses).orElse(StressState.ZERO);
    }

    public OptionalInt getFailedStep() {
        return failedStep > 0 ? OptionalInt.of(failedStep) : OptionalInt.empty();
    }

    /**
     * Number of element evaluations over the whole run.
     */
    public int getCalculationCount() {
        return calculationCount;
    }

    /**
     * Strains of the last converged step, zero if no step converged.
     */
    public StrainState getFinalStrains() {
        return getLastStep().map(StepResult::getAverageStrains).orElse(StrainState.ZERO);
    }

    /**
     * Solver stiffness at the last converged step.
     */
    public MaterialMatrix getFinalStiffness() {
        return stiffness.copy();
    }
}
