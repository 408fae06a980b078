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
import com.powsybl.openmembrane.material.reinforcement.WebReinforcement;
import com.powsybl.openmembrane.plane.StrainState;

import java.util.Objects;

/**
 * Model specific part of the membrane element computation.
 *
 * @author Open Membrane team
 */
public interface ConstitutiveVariant {

    static ConstitutiveVariant create(ConstitutiveModel model, boolean considerCrackSlip) {
        Objects.requireNonNull(model);
        return switch (model) {
            case MCFT -> new McftVariant();
            case DSFM -> new DsfmVariant(considerCrackSlip);
            case SMM -> new SmmVariant();
        };
    }

    ConstitutiveModel getModel();

    ConcreteConstitutiveLaw createLaw(ConcreteParameters parameters, WebReinforcement reinforcement);

    /**
     * Compute concrete and reinforcement stresses for the applied average strains.
     */
    void computeConcreteResponse(Membrane membrane, StrainState appliedStrains);

    /**
     * Limit the concrete tensile stress by the local equilibrium at cracks.
     */
    void applyCrackCheck(Membrane membrane);

    default StrainState getCrackSlipStrains() {
        return StrainState.ZERO;
    }

    default CrackSlipApproach getCrackSlipApproach() {
        return CrackSlipApproach.NONE;
    }
}
