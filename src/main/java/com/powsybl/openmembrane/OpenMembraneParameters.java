/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.openmembrane.element.Membrane;
import com.powsybl.openmembrane.material.concrete.ConcreteParameters;
import com.powsybl.openmembrane.material.concrete.ConstitutiveModel;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcement;
import com.powsybl.openmembrane.solver.DefaultMembraneStoppingCriteria;
import com.powsybl.openmembrane.solver.MembraneSolverParameters;
import com.powsybl.openmembrane.solver.StiffnessUpdateMode;

import java.util.List;
import java.util.Objects;

/**
 * Analysis parameters, with their defaults and their loading from the platform configuration
 * ({@value #MODULE_NAME} module).
 *
 * @author Open Membrane team
 */
public class OpenMembraneParameters {

    public static final String MODULE_NAME = "open-membrane-default-parameters";

    public static final ConstitutiveModel CONSTITUTIVE_MODEL_DEFAULT_VALUE = ConstitutiveModel.MCFT;

    public static final boolean CONSIDER_CRACK_SLIP_DEFAULT_VALUE = true;

    public static final String CONSTITUTIVE_MODEL_PARAM_NAME = "constitutiveModel";

    public static final String CONSIDER_CRACK_SLIP_PARAM_NAME = "considerCrackSlip";

    public static final String NUMBER_OF_STEPS_PARAM_NAME = "numberOfSteps";

    public static final String MAX_ITERATIONS_PARAM_NAME = "maxIterations";

    public static final String STRESS_TOLERANCE_PARAM_NAME = "stressTolerance";

    public static final String STRAIN_TOLERANCE_PARAM_NAME = "strainTolerance";

    public static final String MIN_ITERATIONS_PARAM_NAME = "minIterations";

    public static final String STIFFNESS_UPDATE_MODE_PARAM_NAME = "stiffnessUpdateMode";

    public static final String SIMULATE_PARAM_NAME = "simulate";

    public static final String MAX_SIMULATION_STEPS_PARAM_NAME = "maxSimulationSteps";

    public static final List<String> SPECIFIC_PARAMETERS_NAMES = List.of(CONSTITUTIVE_MODEL_PARAM_NAME,
                                                                         CONSIDER_CRACK_SLIP_PARAM_NAME,
                                                                         NUMBER_OF_STEPS_PARAM_NAME,
                                                                         MAX_ITERATIONS_PARAM_NAME,
                                                                         STRESS_TOLERANCE_PARAM_NAME,
                                                                         STRAIN_TOLERANCE_PARAM_NAME,
                                                                         MIN_ITERATIONS_PARAM_NAME,
                                                                         STIFFNESS_UPDATE_MODE_PARAM_NAME,
                                                                         SIMULATE_PARAM_NAME,
                                                                         MAX_SIMULATION_STEPS_PARAM_NAME);

    private ConstitutiveModel constitutiveModel = CONSTITUTIVE_MODEL_DEFAULT_VALUE;

    private boolean considerCrackSlip = CONSIDER_CRACK_SLIP_DEFAULT_VALUE;

    private int numberOfSteps = MembraneSolverParameters.DEFAULT_NUMBER_OF_STEPS;

    private int maxIterations = MembraneSolverParameters.DEFAULT_MAX_ITERATIONS;

    private double stressTolerance = MembraneSolverParameters.DEFAULT_STRESS_TOLERANCE;

    private double strainTolerance = MembraneSolverParameters.DEFAULT_STRAIN_TOLERANCE;

    private int minIterations = DefaultMembraneStoppingCriteria.DEFAULT_MIN_ITERATIONS;

    private StiffnessUpdateMode stiffnessUpdateMode = MembraneSolverParameters.DEFAULT_STIFFNESS_UPDATE_MODE;

    private boolean simulate = MembraneSolverParameters.DEFAULT_SIMULATE;

    private int maxSimulationSteps = MembraneSolverParameters.DEFAULT_MAX_SIMULATION_STEPS;

    public ConstitutiveModel getConstitutiveModel() {
        return constitutiveModel;
    }

    public OpenMembraneParameters setConstitutiveModel(ConstitutiveModel constitutiveModel) {
        this.constitutiveModel = Objects.requireNonNull(constitutiveModel);
        return this;
    }

    public boolean isConsiderCrackSlip() {
        return considerCrackSlip;
    }

    public OpenMembraneParameters setConsiderCrackSlip(boolean considerCrackSlip) {
        this.considerCrackSlip = considerCrackSlip;
        return this;
    }

    public int getNumberOfSteps() {
        return numberOfSteps;
    }

    public OpenMembraneParameters setNumberOfSteps(int numberOfSteps) {
        this.numberOfSteps = MembraneSolverParameters.checkNumberOfSteps(numberOfSteps);
        return this;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public OpenMembraneParameters setMaxIterations(int maxIterations) {
        this.maxIterations = MembraneSolverParameters.checkMaxIteration(maxIterations);
        return this;
    }

    public double getStressTolerance() {
        return stressTolerance;
    }

    public OpenMembraneParameters setStressTolerance(double stressTolerance) {
        this.stressTolerance = checkTolerance(stressTolerance);
        return this;
    }

    public double getStrainTolerance() {
        return strainTolerance;
    }

    public OpenMembraneParameters setStrainTolerance(double strainTolerance) {
        this.strainTolerance = checkTolerance(strainTolerance);
        return this;
    }

    public int getMinIterations() {
        return minIterations;
    }

    public OpenMembraneParameters setMinIterations(int minIterations) {
        if (minIterations < 1) {
            throw new IllegalArgumentException("Invalid min iterations: " + minIterations);
        }
        this.minIterations = minIterations;
        return this;
    }

    public StiffnessUpdateMode getStiffnessUpdateMode() {
        return stiffnessUpdateMode;
    }

    public OpenMembraneParameters setStiffnessUpdateMode(StiffnessUpdateMode stiffnessUpdateMode) {
        this.stiffnessUpdateMode = Objects.requireNonNull(stiffnessUpdateMode);
        return this;
    }

    public boolean isSimulate() {
        return simulate;
    }

    public OpenMembraneParameters setSimulate(boolean simulate) {
        this.simulate = simulate;
        return this;
    }

    public int getMaxSimulationSteps() {
        return maxSimulationSteps;
    }

    public OpenMembraneParameters setMaxSimulationSteps(int maxSimulationSteps) {
        this.maxSimulationSteps = MembraneSolverParameters.checkNumberOfSteps(maxSimulationSteps);
        return this;
    }

    private static double checkTolerance(double tolerance) {
        if (tolerance <= 0) {
            throw new IllegalArgumentException("Invalid tolerance: " + tolerance);
        }
        return tolerance;
    }

    public static OpenMembraneParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static OpenMembraneParameters load(PlatformConfig platformConfig) {
        OpenMembraneParameters parameters = new OpenMembraneParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setConstitutiveModel(config.getEnumProperty(CONSTITUTIVE_MODEL_PARAM_NAME, ConstitutiveModel.class, CONSTITUTIVE_MODEL_DEFAULT_VALUE))
                .setConsiderCrackSlip(config.getBooleanProperty(CONSIDER_CRACK_SLIP_PARAM_NAME, CONSIDER_CRACK_SLIP_DEFAULT_VALUE))
                .setNumberOfSteps(config.getIntProperty(NUMBER_OF_STEPS_PARAM_NAME, MembraneSolverParameters.DEFAULT_NUMBER_OF_STEPS))
                .setMaxIterations(config.getIntProperty(MAX_ITERATIONS_PARAM_NAME, MembraneSolverParameters.DEFAULT_MAX_ITERATIONS))
                .setStressTolerance(config.getDoubleProperty(STRESS_TOLERANCE_PARAM_NAME, MembraneSolverParameters.DEFAULT_STRESS_TOLERANCE))
                .setStrainTolerance(config.getDoubleProperty(STRAIN_TOLERANCE_PARAM_NAME, MembraneSolverParameters.DEFAULT_STRAIN_TOLERANCE))
                .setMinIterations(config.getIntProperty(MIN_ITERATIONS_PARAM_NAME, DefaultMembraneStoppingCriteria.DEFAULT_MIN_ITERATIONS))
                .setStiffnessUpdateMode(config.getEnumProperty(STIFFNESS_UPDATE_MODE_PARAM_NAME, StiffnessUpdateMode.class, MembraneSolverParameters.DEFAULT_STIFFNESS_UPDATE_MODE))
                .setSimulate(config.getBooleanProperty(SIMULATE_PARAM_NAME, MembraneSolverParameters.DEFAULT_SIMULATE))
                .setMaxSimulationSteps(config.getIntProperty(MAX_SIMULATION_STEPS_PARAM_NAME, MembraneSolverParameters.DEFAULT_MAX_SIMULATION_STEPS)));
        return parameters;
    }

    public MembraneSolverParameters toSolverParameters() {
        return new MembraneSolverParameters()
                .setNumberOfSteps(numberOfSteps)
                .setMaxIterations(maxIterations)
                .setStiffnessUpdateMode(stiffnessUpdateMode)
                .setStressStoppingCriteria(new DefaultMembraneStoppingCriteria(stressTolerance, minIterations))
                .setStrainStoppingCriteria(new DefaultMembraneStoppingCriteria(strainTolerance, minIterations))
                .setSimulate(simulate)
                .setMaxSimulationSteps(maxSimulationSteps);
    }

    /**
     * New element with the configured constitutive model.
     */
    public Membrane createMembrane(ConcreteParameters concreteParameters, WebReinforcement reinforcement) {
        return Membrane.create(concreteParameters, reinforcement, constitutiveModel, considerCrackSlip);
    }

    @Override
    public String toString() {
        return "OpenMembraneParameters(" +
                "constitutiveModel=" + constitutiveModel +
                ", considerCrackSlip=" + considerCrackSlip +
                ", numberOfSteps=" + numberOfSteps +
                ", maxIterations=" + maxIterations +
                ", stressTolerance=" + stressTolerance +
                ", strainTolerance=" + strainTolerance +
                ", minIterations=" + minIterations +
                ", stiffnessUpdateMode=" + stiffnessUpdateMode +
                ", simulate=" + simulate +
                ", maxSimulationSteps=" + maxSimulationSteps +
                ')';
    }
}
