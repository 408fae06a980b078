/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.solver;

import com.powsybl.math.matrix.MatrixException;
import com.powsybl.openmembrane.element.Membrane;
import com.powsybl.openmembrane.plane.MaterialMatrix;
import com.powsybl.openmembrane.plane.StrainState;
import com.powsybl.openmembrane.plane.StressState;
import com.powsybl.openmembrane.util.Vectors;
import org.apache.commons.lang3.mutable.MutableInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Incremental quasi-Newton solver of a membrane element, under applied stresses or applied strains.
 * <p>
 * A run starts from the unloaded state and the element initial stiffness. A singular solver stiffness is replaced by
 * the element secant stiffness, or by its initial stiffness when the secant one is singular too, and the iterations go
 * on. Failures (iteration limit, non finite stresses) stop the run and are reported in the result, the steps converged
 * so far are kept.
 * The element is not reset between runs: use a new element for each run.
 *
 * @author Open Membrane team
 */
public class MembraneSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(MembraneSolver.class);

    private final Membrane membrane;

    private final MembraneSolverParameters parameters;

    /**
     * State shared by the steps of one run.
     */
    private static final class RunContext {

        private final List<StepResult> steps = new ArrayList<>();

        private final MutableInt calculationCount = new MutableInt();

        private MaterialMatrix stiffness;

        private StrainState convergedStrains = StrainState.ZERO;

        private StressState convergedStresses = StressState.ZERO;

        private StressState crackingStresses;

        private int crackingStep;

        private RunContext(MaterialMatrix stiffness) {
            this.stiffness = stiffness;
        }
    }

    @FunctionalInterface
    private interface StepSolver {

        MembraneSolverStatus solveStep(int step, RunContext context);
    }

    public MembraneSolver(Membrane membrane, MembraneSolverParameters parameters) {
        this.membrane = Objects.requireNonNull(membrane);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public Membrane getMembrane() {
        return membrane;
    }

    public MembraneSolverParameters getParameters() {
        return parameters;
    }

    /**
     * Stress control: step k targets k / numberOfSteps of the applied stresses.
     */
    public MembraneSolverResult solve(StressState appliedStresses) {
        Objects.requireNonNull(appliedStresses);
        LOGGER.info("Start stress controlled analysis of {} element to {} ({})", membrane.getModel(), appliedStresses, parameters);
        return run((step, context) -> solveStressStep(step, appliedStresses, context));
    }

    /**
     * Strain control: step k applies k / numberOfSteps of the applied strains, the element is evaluated until its
     * stresses no longer change.
     */
    public MembraneSolverResult solve(StrainState appliedStrains) {
        Objects.requireNonNull(appliedStrains);
        LOGGER.info("Start strain controlled analysis of {} element to {} ({})", membrane.getModel(), appliedStrains, parameters);
        return run((step, context) -> solveStrainStep(step, appliedStrains, context));
    }

    private MembraneSolverResult run(StepSolver stepSolver) {
        RunContext context = new RunContext(membrane.getInitialStiffness());
        int lastStep = parameters.isSimulate() ? parameters.getMaxSimulationSteps() : parameters.getNumberOfSteps();

        MembraneSolverStatus status = MembraneSolverStatus.NO_CALCULATION;
        int failedStep = 0;
        for (int step = 1; step <= lastStep; step++) {
            MembraneSolverStatus stepStatus = stepSolver.solveStep(step, context);
            if (stepStatus != MembraneSolverStatus.CONVERGED) {
                status = stepStatus;
                failedStep = step;
                LOGGER.warn("Step {} not converged ({}), analysis stopped after {} converged steps", step, stepStatus,
                        context.steps.size());
                break;
            }
            status = MembraneSolverStatus.CONVERGED;
        }

        LOGGER.info("Analysis done: status={}, steps={}, element calculations={}", status, context.steps.size(),
                context.calculationCount);
        return new MembraneSolverResult(status, context.steps, context.crackingStresses, context.crackingStep,
                failedStep, context.calculationCount.intValue(), context.stiffness);
    }

    private double loadFactor(int step) {
        return (double) step / parameters.getNumberOfSteps();
    }

    private MembraneSolverStatus solveStressStep(int step, StressState appliedStresses, RunContext context) {
        StressState target = appliedStresses.multiply(loadFactor(step));

        StrainState strains;
        try {
            strains = context.convergedStrains.add(solveLinear(target.subtract(context.convergedStresses), step, context));
        } catch (MatrixException e) {
            LOGGER.error(e.toString(), e);
            return MembraneSolverStatus.SOLVER_FAILED;
        }

        IterationRecord previous = null;
        StrainState firstIncrement = null;
        MutableInt iterations = new MutableInt(1);
        while (iterations.intValue() <= parameters.getMaxIterations()) {
            int iteration = iterations.intValue();

            membrane.calculate(strains);
            context.calculationCount.increment();
            StressState stresses = membrane.getAverageStresses();
            StressState residual = stresses.subtract(target);
            if (!residual.isFinite()) {
                LOGGER.warn("Step {}, iteration {}: non finite residual {}", step, iteration, residual);
                return MembraneSolverStatus.SOLVER_FAILED;
            }

            MembraneStoppingCriteria.TestResult stressTest = parameters.getStressStoppingCriteria()
                    .test(residual.toArray(), target.toArray(), iteration);
            LOGGER.debug("Step {}, iteration {}: stress convergence={}", step, iteration, stressTest.getConvergence());
            if (stressTest.isStop()) {
                return converge(step, iteration, target, context);
            }
            if (iteration == parameters.getMaxIterations()) {
                break;
            }

            if (previous != null) {
                context.stiffness = updateStiffness(context.stiffness, previous, strains, stresses, residual);
            }
            IterationRecord current = new IterationRecord(strains, stresses, residual, context.stiffness);

            // solve K.de = -r
            StrainState increment;
            try {
                increment = solveLinear(residual, step, context).negate();
            } catch (MatrixException e) {
                LOGGER.error(e.toString(), e);
                return MembraneSolverStatus.SOLVER_FAILED;
            }
            if (firstIncrement == null) {
                firstIncrement = increment;
            }

            MembraneStoppingCriteria.TestResult strainTest = parameters.getStrainStoppingCriteria()
                    .test(increment.toArray(), firstIncrement.toArray(), iteration);
            LOGGER.trace("Step {}, iteration {}: strain increment {}, strain convergence={}", step, iteration, increment,
                    strainTest.getConvergence());
            if (strainTest.isStop()) {
                return converge(step, iteration, target, context);
            }

            previous = current;
            strains = strains.add(increment);
            iterations.increment();
        }
        return MembraneSolverStatus.MAX_ITERATION_REACHED;
    }

    /**
     * Solves K.x = b with the solver stiffness, falling back on the element secant then initial stiffness when it is
     * singular. The initial stiffness of a valid element is positive definite.
     */
    private StrainState solveLinear(StressState b, int step, RunContext context) {
        try {
            return context.stiffness.solve(b);
        } catch (MatrixException e) {
            LOGGER.warn("Step {}: {}, solver stiffness reset to the element secant stiffness", step, e.getMessage());
            context.stiffness = membrane.getStiffness();
        }
        try {
            return context.stiffness.solve(b);
        } catch (MatrixException e) {
            LOGGER.warn("Step {}: {}, solver stiffness reset to the element initial stiffness", step, e.getMessage());
            context.stiffness = membrane.getInitialStiffness();
        }
        return context.stiffness.solve(b);
    }

    private MaterialMatrix updateStiffness(MaterialMatrix stiffness, IterationRecord previous, StrainState strains,
                                           StressState stresses, StressState residual) {
        double[] strainChange = strains.subtract(previous.strains()).toArray();
        double squaredNorm = Vectors.squaredNorm(strainChange);
        if (squaredNorm == 0) {
            return stiffness;
        }
        return switch (parameters.getStiffnessUpdateMode()) {
            case SECANT -> {
                double[] residualChange = residual.subtract(previous.residual()).toArray();
                double[] unbalanced = Vectors.minus(residualChange, stiffness.multiply(strainChange));
                for (int i = 0; i < unbalanced.length; i++) {
                    unbalanced[i] /= squaredNorm;
                }
                yield stiffness.add(MaterialMatrix.outerProduct(unbalanced, strainChange));
            }
            case NEWTON_RAPHSON -> {
                double[] stressChange = stresses.subtract(previous.stresses()).toArray();
                yield stiffness.add(MaterialMatrix.outerProduct(stressChange, strainChange));
            }
        };
    }

    private MembraneSolverStatus solveStrainStep(int step, StrainState appliedStrains, RunContext context) {
        StrainState strains = appliedStrains.multiply(loadFactor(step));

        StressState previousStresses = null;
        MutableInt iterations = new MutableInt(1);
        while (iterations.intValue() <= parameters.getMaxIterations()) {
            int iteration = iterations.intValue();

            membrane.calculate(strains);
            context.calculationCount.increment();
            StressState stresses = membrane.getAverageStresses();
            if (!stresses.isFinite()) {
                LOGGER.warn("Step {}, iteration {}: non finite stresses {}", step, iteration, stresses);
                return MembraneSolverStatus.SOLVER_FAILED;
            }

            if (previousStresses != null) {
                MembraneStoppingCriteria.TestResult stressTest = parameters.getStressStoppingCriteria()
                        .test(stresses.subtract(previousStresses).toArray(), stresses.toArray(), iteration);
                LOGGER.debug("Step {}, iteration {}: stress convergence={}", step, iteration, stressTest.getConvergence());
                if (stressTest.isStop()) {
                    context.stiffness = membrane.getStiffness();
                    return converge(step, iteration, stresses, context);
                }
            }
            previousStresses = stresses;
            iterations.increment();
        }
        return MembraneSolverStatus.MAX_ITERATION_REACHED;
    }

    private MembraneSolverStatus converge(int step, int iterations, StressState target, RunContext context) {
        context.convergedStrains = membrane.getAverageStrains();
        context.convergedStresses = membrane.getAverageStresses();
        StepResult result = new StepResult(step, iterations, target, membrane, context.stiffness);
        context.steps.add(result);

        if (context.crackingStep == 0 && membrane.isCracked()) {
            context.crackingStep = step;
            context.crackingStresses = context.convergedStresses;
            LOGGER.info("Concrete cracked at step {}: {}", step, context.crackingStresses);
        }
        LOGGER.info("Step {} converged in {} iterations (crack slip approach: {})", step, iterations,
                result.getCrackSlipApproach());
        return MembraneSolverStatus.CONVERGED;
    }
}
