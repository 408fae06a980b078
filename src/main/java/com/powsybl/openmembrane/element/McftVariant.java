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
import com.powsybl.openmembrane.material.concrete.McftConstitutiveLaw;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcement;
import com.powsybl.openmembrane.plane.StrainState;

/**
 * Concrete and reinforcement share the average strains.
 *
 * @author Open Membrane team
 */
public class McftVariant implements ConstitutiveVariant {

    @Override
    public ConstitutiveModel getModel() {
        return ConstitutiveModel.MCFT;
    }

    @Override
    public ConcreteConstitutiveLaw createLaw(ConcreteParameters parameters, WebReinforcement reinforcement) {
        return new McftConstitutiveLaw(parameters);
    }

    @Override
    public void computeConcreteResponse(Membrane membrane, StrainState appliedStrains) {
        membrane.getConcrete().calculate(appliedStrains.toPrincipal());
        membrane.getReinforcement().calculate(appliedStrains);
    }

    @Override
    public void applyCrackCheck(Membrane membrane) {
        CrackCheck.apply(membrane);
    }
}
