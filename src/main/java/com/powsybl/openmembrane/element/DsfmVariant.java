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
import com.powsybl.openmembrane.material.concrete.DsfmConstitutiveLaw;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcement;
import com.powsybl.openmembrane.plane.StrainState;

/**
 * Concrete receives the average strains minus the crack slip strains of the previous evaluation, reinforcement the
 * average strains. Slip strains are updated once stresses are known.
 *
 * @author Open Membrane team
 */
public class DsfmVariant implements ConstitutiveVariant {

    private final boolean considerCrackSlip;

    private StrainState crackSlipStrains = StrainState.ZERO;

    private CrackSlipApproach crackSlipApproach = CrackSlipApproach.NONE;

    public DsfmVariant(boolean considerCrackSlip) {
        this.considerCrackSlip = considerCrackSlip;
    }

    public boolean isConsiderCrackSlip() {
        return considerCrackSlip;
    }

    @Override
    public ConstitutiveModel getModel() {
        return ConstitutiveModel.DSFM;
    }

    @Override
    public ConcreteConstitutiveLaw createLaw(ConcreteParameters parameters, WebReinforcement reinforcement) {
        return new DsfmConstitutiveLaw(parameters, reinforcement, considerCrackSlip);
    }

    @Override
    public void computeConcreteResponse(Membrane membrane, StrainState appliedStrains) {
        StrainState concreteStrains = appliedStrains.subtract(crackSlipStrains);
        membrane.getConcrete().calculate(concreteStrains.toPrincipal());
        membrane.getReinforcement().calculate(appliedStrains);

        if (considerCrackSlip && membrane.isCracked()) {
            CrackSlip.Result slip = CrackSlip.calculate(membrane);
            crackSlipStrains = slip.strains();
            crackSlipApproach = slip.approach();
        }
    }

    @Override
    public void applyCrackCheck(Membrane membrane) {
        CrackCheck.apply(membrane);
    }

    @Override
    public StrainState getCrackSlipStrains() {
        return crackSlipStrains;
    }

    @Override
    public CrackSlipApproach getCrackSlipApproach() {
        return crackSlipApproach;
    }
}
