/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.material.concrete;

import net.jafama.FastMath;

import java.util.Locale;
import java.util.Objects;

/**
 * Concrete mechanical properties, in MPa and mm.
 *
 * @author Open Membrane team
 */
public class ConcreteParameters {

    public static final double DEFAULT_PLASTIC_STRAIN = -0.002;

    /**
     * Fracture energy, in N/mm.
     */
    public static final double DEFAULT_FRACTURE_ENERGY = 0.075;

    private final double strength;

    private final double aggregateDiameter;

    private final double tensileStrength;

    private final double elasticModulus;

    private final double plasticStrain;

    private final double fractureEnergy;

    public ConcreteParameters(double strength, double aggregateDiameter, double tensileStrength, double elasticModulus,
                              double plasticStrain, double fractureEnergy) {
        if (strength <= 0) {
            throw new IllegalArgumentException("Invalid concrete strength: " + strength);
        }
        if (aggregateDiameter <= 0) {
            throw new IllegalArgumentException("Invalid aggregate diameter: " + aggregateDiameter);
        }
        if (tensileStrength <= 0) {
            throw new IllegalArgumentException("Invalid concrete tensile strength: " + tensileStrength);
        }
        if (elasticModulus <= 0) {
            throw new IllegalArgumentException("Invalid concrete elastic modulus: " + elasticModulus);
        }
        if (plasticStrain >= 0) {
            throw new IllegalArgumentException("Peak compressive strain must be negative: " + plasticStrain);
        }
        if (fractureEnergy <= 0) {
            throw new IllegalArgumentException("Invalid fracture energy: " + fractureEnergy);
        }
        this.strength = strength;
        this.aggregateDiameter = aggregateDiameter;
        this.tensileStrength = tensileStrength;
        this.elasticModulus = elasticModulus;
        this.plasticStrain = plasticStrain;
        this.fractureEnergy = fractureEnergy;
    }

    /**
     * Parameters derived from the compressive strength with the relations of the given model.
     */
    public static ConcreteParameters create(double strength, double aggregateDiameter, ConstitutiveModel model) {
        Objects.requireNonNull(model);
        if (strength <= 0) {
            throw new IllegalArgumentException("Invalid concrete strength: " + strength);
        }
        double sqrtStrength = FastMath.sqrt(strength);
        return switch (model) {
            case MCFT, DSFM -> new ConcreteParameters(strength, aggregateDiameter, 0.33 * sqrtStrength,
                    -2 * strength / DEFAULT_PLASTIC_STRAIN, DEFAULT_PLASTIC_STRAIN, DEFAULT_FRACTURE_ENERGY);
            case SMM -> new ConcreteParameters(strength, aggregateDiameter, 0.31 * sqrtStrength,
                    3875 * sqrtStrength, DEFAULT_PLASTIC_STRAIN, DEFAULT_FRACTURE_ENERGY);
        };
    }

    public double getStrength() {
        return strength;
    }

    public double getAggregateDiameter() {
        return aggregateDiameter;
    }

    public double getTensileStrength() {
        return tensileStrength;
    }

    public double getElasticModulus() {
        return elasticModulus;
    }

    public double getPlasticStrain() {
        return plasticStrain;
    }

    public double getCrackingStrain() {
        return tensileStrength / elasticModulus;
    }

    public double getFractureEnergy() {
        return fractureEnergy;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "ConcreteParameters(fc=%.2f, aggregateDiameter=%.1f, fcr=%.3f, Ec=%.1f, epsilon0=%.4f, Gf=%.3f)",
                strength, aggregateDiameter, tensileStrength, elasticModulus, plasticStrain, fractureEnergy);
    }
}
