/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.material.reinforcement;

import com.powsybl.openmembrane.plane.MaterialMatrix;
import com.powsybl.openmembrane.plane.StrainState;
import com.powsybl.openmembrane.plane.StressState;
import com.powsybl.openmembrane.util.Angles;
import net.jafama.FastMath;

import java.util.Objects;

/**
 * One smeared layer of parallel bars, with its current axial strain and stress.
 *
 * @author Open Membrane team
 */
public class WebReinforcementDirection {

    /**
     * Crack spacing used when a direction carries no reinforcement, in mm.
     */
    public static final double DEFAULT_CRACK_SPACING = 21;

    private static final double CRACK_SPACING_FACTOR = 5.4;

    private final double diameter;

    private final double spacing;

    private final double ratio;

    private final SteelParameters steel;

    private final double angle;

    private double strain;

    private double stress;

    public WebReinforcementDirection(double diameter, double spacing, double ratio, SteelParameters steel, double angle) {
        if (diameter <= 0) {
            throw new IllegalArgumentException("Invalid bar diameter: " + diameter);
        }
        if (spacing <= 0) {
            throw new IllegalArgumentException("Invalid bar spacing: " + spacing);
        }
        if (ratio < 0) {
            throw new IllegalArgumentException("Invalid reinforcement ratio: " + ratio);
        }
        this.diameter = diameter;
        this.spacing = spacing;
        this.ratio = ratio;
        this.steel = Objects.requireNonNull(steel);
        this.angle = angle;
    }

    /**
     * Bars of diameter {@code diameter} every {@code spacing} on both faces of a panel of thickness {@code width}.
     */
    public static WebReinforcementDirection create(double diameter, double spacing, SteelParameters steel, double width, double angle) {
        if (width <= 0) {
            throw new IllegalArgumentException("Invalid panel width: " + width);
        }
        double barArea = FastMath.PI * diameter * diameter / 4;
        double ratio = 2 * barArea / (spacing * width);
        return new WebReinforcementDirection(diameter, spacing, ratio, steel, angle);
    }

    public double getDiameter() {
        return diameter;
    }

    public double getSpacing() {
        return spacing;
    }

    public double getRatio() {
        return ratio;
    }

    public SteelParameters getSteel() {
        return steel;
    }

    public double getAngle() {
        return angle;
    }

    public double getStrain() {
        return strain;
    }

    public double getStress() {
        return stress;
    }

    public boolean isYielded() {
        return FastMath.abs(strain) >= steel.yieldStrain();
    }

    public void calculate(StrainState strains) {
        strain = strains.transform(angle).getEpsilonX();
        stress = stressAt(strain);
    }

    /**
     * Bar stress for an axial strain, without changing the state of this layer.
     */
    public double stressAt(double axialStrain) {
        double elasticStress = steel.elasticModulus() * axialStrain;
        return Math.max(-steel.yieldStress(), Math.min(steel.yieldStress(), elasticStress));
    }

    public double getSecantModulus() {
        return strain == 0 ? steel.elasticModulus() : stress / strain;
    }

    /**
     * Remaining tensile capacity of the layer, rho * (fy - fs).
     */
    public double capacityReserve() {
        return ratio * (steel.yieldStress() - stress);
    }

    public double crackSpacing() {
        return ratio > 0 ? diameter / (CRACK_SPACING_FACTOR * ratio) : DEFAULT_CRACK_SPACING;
    }

    StressState getStresses() {
        double[] v = axisVector();
        double smeared = ratio * stress;
        return new StressState(smeared * v[0], smeared * v[1], smeared * v[2]);
    }

    MaterialMatrix getStiffness() {
        return stiffness(getSecantModulus());
    }

    MaterialMatrix getInitialStiffness() {
        return stiffness(steel.elasticModulus());
    }

    private MaterialMatrix stiffness(double modulus) {
        double[] v = axisVector();
        double factor = ratio * modulus;
        return MaterialMatrix.outerProduct(new double[] {factor * v[0], factor * v[1], factor * v[2]}, v);
    }

    private double[] axisVector() {
        double cos = Angles.cos(angle);
        double sin = Angles.sin(angle);
        return new double[] {cos * cos, sin * sin, cos * sin};
    }

    public WebReinforcementDirection copy() {
        WebReinforcementDirection copy = new WebReinforcementDirection(diameter, spacing, ratio, steel, angle);
        copy.strain = strain;
        copy.stress = stress;
        return copy;
    }
}
