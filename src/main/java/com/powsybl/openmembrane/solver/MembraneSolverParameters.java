/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.solver;

import java.util.Objects;

/**
 * @author Open Membrane team
 */
public class MembraneSolverParameters {

    public static final int DEFAULT_NUMBER_OF_STEPS = 100;

    public static final int DEFAULT_MAX_ITERATIONS = 10000;

    public static final double DEFAULT_STRESS_TOLERANCE = 1E-3;

    public static final double DEFAULT_STRAIN_TOLERANCE = 1E-12;

    public static final StiffnessUpdateMode DEFAULT_STIFFNESS_UPDATE_MODE = StiffnessUpdateMode.NEWTON_RAPHSON;

    public static final boolean DEFAULT_SIMULATE = false;

    public static final int DEFAULT_MAX_SIMULATION_STEPS = 1000;

    private int numberOfSteps = DEFAULT_NUMBER_OF_STEPS;

    private int maxIterations = DEFAULT_MAX_ITERATIONS;

    private StiffnessUpdateMode stiffnessUpdateMode = DEFAULT_STIFFNESS_UPDATE_MODE;

    private MembraneStoppingCriteria stressStoppingCriteria = new DefaultMembraneStoppingCriteria(DEFAULT_STRESS_TOLERANCE);

    private MembraneStoppingCriteria strainStoppingCriteria = new DefaultMembraneStoppingCriteria(DEFAULT_STRAIN_TOLERANCE);

    private boolean simulate = DEFAULT_SIMULATE;

    private int maxSimulationSteps = DEFAULT_MAX_SIMULATION_STEPS;

    public static int checkMaxIteration(int maxIteration) {
        if (maxIteration < 1) {
            throw new IllegalArgumentException("Invalid max iteration value: " + maxIteration);
        }
        return maxIteration;
    }

    public static int checkNumberOfSteps(int numberOfSteps) {
        if (numberOfSteps < 1) {
            throw new IllegalArgumentException("Invalid number of steps: " + numberOfSteps);
        }
        return numberOfSteps;
    }

    public int getNumberOfSteps() {
        return numberOfSteps;
    }

    public MembraneSolverParameters setNumberOfSteps(int numberOfSteps) {
        this.numberOfSteps = checkNumberOfSteps(numberOfSteps);
        return this;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public MembraneSolverParameters setMaxIterations(int maxIterations) {
        this.maxIterations = checkMaxIteration(maxIterations);
        return this;
    }

    public StiffnessUpdateMode getStiffnessUpdateMode() {
        return stiffnessUpdateMode;
    }

    public MembraneSolverParameters setStiffnessUpdateMode(StiffnessUpdateMode stiffnessUpdateMode) {
        this.stiffnessUpdateMode = Objects.requireNonNull(stiffnessUpdateMode);
        return this;
    }

    /**
     * Test on the stress residual, scaled by the step target stresses.
     */
    public MembraneStoppingCriteria getStressStoppingCriteria() {
        return stressStoppingCriteria;
    }

    public MembraneSolverParameters setStressStoppingCriteria(MembraneStoppingCriteria stressStoppingCriteria) {
        this.stressStoppingCriteria = Objects.requireNonNull(stressStoppingCriteria);
        return this;
    }

    /**
     * Test on the strain increment, scaled by the first increment of the step.
     */
    public MembraneStoppingCriteria getStrainStoppingCriteria() {
        return strainStoppingCriteria;
    }

    public MembraneSolverParameters setStrainStoppingCriteria(MembraneStoppingCriteria strainStoppingCriteria) {
        this.strainStoppingCriteria = Objects.requireNonNull(strainStoppingCriteria);
        return this;
    }

    public boolean isSimulate() {
        return simulate;
    }

    /**
     * Keep stepping past the number of steps until the element fails.
     */
    public MembraneSolverParameters setSimulate(boolean simulate) {
        this.simulate = simulate;
        return this;
    }

    public int getMaxSimulationSteps() {
        return maxSimulationSteps;
    }

    public MembraneSolverParameters setMaxSimulationSteps(int maxSimulationSteps) {
        this.maxSimulationSteps = checkNumberOfSteps(maxSimulationSteps);
        return this;
    }

    @Override
    public String toString() {
        return "MembraneSolverParameters(" +
                "numberOfSteps=" + numberOfSteps +
                ", maxIterations=" + maxIterations +
                ", stiffnessUpdateMode=" + stiffnessUpdateMode +
                ", stressStoppingCriteria=" + stressStoppingCriteria.getClass().getSimpleName() +
                ", strainStoppingCriteria=" + strainStoppingCriteria.getClass().getSimpleName() +
                ", simulate=" + simulate +
                ", maxSimulationSteps=" + maxSimulationSteps +
                ')';
    }
}
