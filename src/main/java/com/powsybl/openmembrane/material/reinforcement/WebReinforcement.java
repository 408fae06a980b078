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

import java.util.Optional;

/**
 * Smeared web reinforcement with at most two layers, nominally along x and y.
 *
 * @author Open Membrane team
 */
public class WebReinforcement {

    private final WebReinforcementDirection x;

    private final WebReinforcementDirection y;

    public WebReinforcement(WebReinforcementDirection x, WebReinforcementDirection y) {
        this.x = x;
        this.y = y;
    }

    public static WebReinforcement none() {
        return new WebReinforcement(null, null);
    }

    public static WebReinforcement create(double diameterX, double spacingX, double diameterY, double spacingY,
                                          SteelParameters steel, double width) {
        return new WebReinforcement(WebReinforcementDirection.create(diameterX, spacingX, steel, width, 0),
                                    WebReinforcementDirection.create(diameterY, spacingY, steel, width, Angles.PI_OVER_2));
    }

    public Optional<WebReinforcementDirection> getX() {
        return Optional.ofNullable(x);
    }

    public Optional<WebReinforcementDirection> getY() {
        return Optional.ofNullable(y);
    }

    public void calculate(StrainState strains) {
        if (x != null) {
            x.calculate(strains);
        }
        if (y != null) {
            y.calculate(strains);
        }
    }

    public StressState getStresses() {
        StressState stresses = StressState.ZERO;
        if (x != null) {
            stresses = stresses.add(x.getStresses());
        }
        if (y != null) {
            stresses = stresses.add(y.getStresses());
        }
        return stresses;
    }

    /**
     * Axial steel strains (epsilonSx, epsilonSy, 0).
     */
    public StrainState getStrains() {
        return new StrainState(x != null ? x.getStrain() : 0, y != null ? y.getStrain() : 0, 0);
    }

    public MaterialMatrix getStiffness() {
        MaterialMatrix stiffness = MaterialMatrix.zero();
        if (x != null) {
            stiffness = stiffness.add(x.getStiffness());
        }
        if (y != null) {
            stiffness = stiffness.add(y.getStiffness());
        }
        return stiffness;
    }

    public MaterialMatrix getInitialStiffness() {
        MaterialMatrix stiffness = MaterialMatrix.zero();
        if (x != null) {
            stiffness = stiffness.add(x.getInitialStiffness());
        }
        if (y != null) {
            stiffness = stiffness.add(y.getInitialStiffness());
        }
        return stiffness;
    }

    /**
     * Angles between the given direction and each bar layer: (theta - alphaX, theta - alphaY).
     */
    public double[] angles(double theta) {
        double alphaX = x != null ? x.getAngle() : 0;
        double alphaY = y != null ? y.getAngle() : Angles.PI_OVER_2;
        return new double[] {theta - alphaX, theta - alphaY};
    }

    public int reinforcedDirectionCount() {
        int count = 0;
        if (x != null && x.getRatio() > 0) {
            count++;
        }
        if (y != null && y.getRatio() > 0) {
            count++;
        }
        return count;
    }

    public double getRatioX() {
        return x != null ? x.getRatio() : 0;
    }

    public double getRatioY() {
        return y != null ? y.getRatio() : 0;
    }

    public double getStressX() {
        return x != null ? x.getStress() : 0;
    }

    public double getStressY() {
        return y != null ? y.getStress() : 0;
    }

    public double capacityReserveX() {
        return x != null ? x.capacityReserve() : 0;
    }

    public double capacityReserveY() {
        return y != null ? y.capacityReserve() : 0;
    }

    public double crackSpacingX() {
        return x != null ? x.crackSpacing() : WebReinforcementDirection.DEFAULT_CRACK_SPACING;
    }

    public double crackSpacingY() {
        return y != null ? y.crackSpacing() : WebReinforcementDirection.DEFAULT_CRACK_SPACING;
    }

    /**
     * Direction with the larger axial strain, empty when the panel is not reinforced.
     */
    public Optional<WebReinforcementDirection> getMostStrainedDirection() {
        if (x == null || y == null) {
            return Optional.ofNullable(x != null ? x : y);
        }
        return Optional.of(x.getStrain() >= y.getStrain() ? x : y);
    }

    public WebReinforcement copy() {
        return new WebReinforcement(x != null ? x.copy() : null, y != null ? y.copy() : null);
    }
}
