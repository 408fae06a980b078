/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.element;

import com.powsybl.openmembrane.material.concrete.ConcreteConstitutiveLaw;
import com.powsybl.openmembrane.material.concrete.ConcreteParameters;
import com.powsybl.openmembrane.material.concrete.ConstitutiveModel;
import com.powsybl.openmembrane.material.concrete.SmmConstitutiveLaw;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcement;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcementDirection;
import com.powsybl.openmembrane.plane.PrincipalStrainState;
import com.powsybl.openmembrane.plane.StrainState;

import java.util.Optional;

/**
 * Principal strains are decoupled from the Poisson effect (Hsu and Zhu ratios) before the concrete and the
 * reinforcement are evaluated. No crack check.
 *
 * @author Open Membrane team
 */
public class SmmVariant implements ConstitutiveVariant {

    static final double UNCRACKED_POISSON_RATIO = 0.2;

    static final double YIELDED_POISSON_RATIO = 1.9;

    @Override
    public ConstitutiveModel getModel() {
        return ConstitutiveModel.SMM;
    }

    @Override
    public ConcreteConstitutiveLaw createLaw(ConcreteParameters parameters, WebReinforcement reinforcement) {
        return new SmmConstitutiveLaw(parameters);
    }

    @Override
    public void computeConcreteResponse(Membrane membrane, StrainState appliedStrains) {
        PrincipalStrainState decoupled = removePoissonEffect(appliedStrains.toPrincipal(), membrane.getReinforcement(),
                membrane.isCracked());
        membrane.getConcrete().calculate(decoupled);
        membrane.getReinforcement().calculate(decoupled.toStrainState());
    }

    @Override
    public void applyCrackCheck(Membrane membrane) {
        // the softened membrane model has no crack check
    }

    static PrincipalStrainState removePoissonEffect(PrincipalStrainState strains, WebReinforcement reinforcement, boolean cracked) {
        double nu21 = cracked ? 0 : UNCRACKED_POISSON_RATIO;
        double nu12 = poissonRatio12(reinforcement);

        double v1 = 1 / (1 - nu12 * nu21);
        double v2 = nu21 * v1;

        double e1i = strains.getEpsilon1();
        double e2i = strains.getEpsilon2();
        return new PrincipalStrainState(v1 * e1i + v2 * e2i, v2 * e1i + v1 * e2i, strains.getTheta1());
    }

    /**
     * Hsu and Zhu ratio, from the strain of the most strained reinforcement layer.
     */
    static double poissonRatio12(WebReinforcement reinforcement) {
        Optional<WebReinforcementDirection> direction = reinforcement.getMostStrainedDirection();
        if (direction.isEmpty() || direction.get().getStrain() <= 0) {
            return UNCRACKED_POISSON_RATIO;
        }
        double strain = direction.get().getStrain();
        return strain >= direction.get().getSteel().yieldStrain()
                ? YIELDED_POISSON_RATIO
                : UNCRACKED_POISSON_RATIO + 850 * strain;
    }
}
