/*
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmembrane.element;

import com.powsybl.openmembrane.material.concrete.BiaxialConcrete;
import com.powsybl.openmembrane.material.concrete.ConcreteParameters;
import com.powsybl.openmembrane.material.concrete.ConstitutiveModel;
import com.powsybl.openmembrane.material.reinforcement.WebReinforcement;
import com.powsybl.openmembrane.plane.MaterialMatrix;
import com.powsybl.openmembrane.plane.PrincipalStrainState;
import com.powsybl.openmembrane.plane.StrainState;
import com.powsybl.openmembrane.plane.StressState;

import java.util.Objects;

/**
 * Reinforced concrete membrane element: biaxial concrete plus smeared web reinforcement, evaluated for an average
 * strain state.
 *
 * @author Open Membrane team
 */
public class Membrane {

    private final BiaxialConcrete concrete;

    private final WebReinforcement reinforcement;

    private final ConstitutiveVariant variant;

    private StrainState averageStrains = StrainState.ZERO;

    private PrincipalStrainState averagePrincipalStrains = PrincipalStrainState.ZERO;

    private Membrane(ConcreteParameters concreteParameters, WebReinforcement reinforcement, ConstitutiveVariant variant) {
        this.reinforcement = reinforcement;
        this.variant = variant;
        this.concrete = new BiaxialConcrete(variant.createLaw(concreteParameters, reinforcement));
    }

    /**
     * Create an element. The reinforcement is copied, a null reinforcement means plain concrete.
     *
     * @param considerCrackSlip only used by {@link ConstitutiveModel#DSFM}
     */
    public static Membrane create(ConcreteParameters concreteParameters, WebReinforcement reinforcement,
                                  ConstitutiveModel model, boolean considerCrackSlip) {
        Objects.requireNonNull(concreteParameters);
        WebReinforcement ownReinforcement = reinforcement != null ? reinforcement.copy() : WebReinforcement.none();
        return new Membrane(concreteParameters, ownReinforcement, ConstitutiveVariant.create(model, considerCrackSlip));
    }

    public static Membrane create(ConcreteParameters concreteParameters, WebReinforcement reinforcement, ConstitutiveModel model) {
        return create(concreteParameters, reinforcement, model, true);
    }

    public void calculate(StrainState appliedStrains) {
        averageStrains = Objects.requireNonNull(appliedStrains);
        averagePrincipalStrains = appliedStrains.toPrincipal();
        variant.computeConcreteResponse(this, appliedStrains);
        variant.applyCrackCheck(this);
    }

    public ConstitutiveModel getModel() {
        return variant.getModel();
    }

    public BiaxialConcrete getConcrete() {
        return concrete;
    }

    public WebReinforcement getReinforcement() {
        return reinforcement;
    }

    public boolean isCracked() {
        return concrete.isCracked();
    }

    public StrainState getAverageStrains() {
        return averageStrains;
    }

    public PrincipalStrainState getAveragePrincipalStrains() {
        return averagePrincipalStrains;
    }

    public StressState getAverageStresses() {
        return concrete.getStresses().add(reinforcement.getStresses());
    }

    public StrainState getConcreteStrains() {
        return concrete.getPrincipalStrains().toStrainState();
    }

    public StrainState getCrackSlipStrains() {
        return variant.getCrackSlipStrains();
    }

    public CrackSlipApproach getCrackSlipApproach() {
        return variant.getCrackSlipApproach();
    }

    /**
     * Secant stiffness of the current state.
     */
    public MaterialMatrix getStiffness() {
        return concrete.getStiffness().add(reinforcement.getStiffness());
    }

    /**
     * Stiffness of the unloaded element.
     */
    public MaterialMatrix getInitialStiffness() {
        return concrete.getInitialStiffness().add(reinforcement.getInitialStiffness());
    }
}
