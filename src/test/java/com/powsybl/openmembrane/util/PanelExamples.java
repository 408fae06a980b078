/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.util;

import com.powsybl.openmembrane.element.Membrane;
import com.powsybl.openmembrane.material.concrete.ConcreteParameters;
import com.powsybl.openmembrane.material.concrete.ConstitutiveModel;
import com.powsybl.openmembrane.material.reinforcement.SteelParameters;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcement;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcementDirection;

/**
 * Panels tested by Vecchio and Collins (1982), 70 mm thick.
 *
 * @author Open Membrane team
 */
public final class PanelExamples {

    public static final double WIDTH = 70;

    private PanelExamples() {
    }

    public static ConcreteParameters pv10Concrete(ConstitutiveModel model) {
        return ConcreteParameters.create(14.5, 6, model);
    }

    public static WebReinforcement pv10Reinforcement() {
        return WebReinforcement.create(6.35, 50.55, 4.7, 49.57, new SteelParameters(276, 200000), WIDTH);
    }

    public static Membrane pv10(ConstitutiveModel model, boolean considerCrackSlip) {
        return Membrane.create(pv10Concrete(model), pv10Reinforcement(), model, considerCrackSlip);
    }

    public static Membrane pv10(ConstitutiveModel model) {
        return pv10(model, true);
    }

    public static Membrane pv11(ConstitutiveModel model) {
        WebReinforcement reinforcement = WebReinforcement.create(6.35, 50.55, 5.44, 50.7, new SteelParameters(235, 200000), WIDTH);
        return Membrane.create(ConcreteParameters.create(15.6, 6, model), reinforcement, model, true);
    }

    public static Membrane pv19(ConstitutiveModel model) {
        WebReinforcement reinforcement = new WebReinforcement(
                WebReinforcementDirection.create(6.35, 50.55, new SteelParameters(458, 200000), WIDTH, 0),
                WebReinforcementDirection.create(4.01, 50.82, new SteelParameters(299, 200000), WIDTH, Angles.PI_OVER_2));
        return Membrane.create(ConcreteParameters.create(19, 6, model), reinforcement, model, true);
    }

    public static Membrane plainConcrete(ConstitutiveModel model) {
        return Membrane.create(pv10Concrete(model), null, model, false);
    }
}
