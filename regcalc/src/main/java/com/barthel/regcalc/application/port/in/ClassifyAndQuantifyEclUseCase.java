package com.barthel.regcalc.application.port.in;

import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.common.Scenario;
import com.barthel.regcalc.domain.model.credit.EclResult;
import com.barthel.regcalc.domain.model.credit.Exposure;

/**
 * Use case for staging a single exposure and quantifying its expected credit loss.
 */
public interface ClassifyAndQuantifyEclUseCase {
    /**
     * Determines the impairment stage and computes the discounted ECL.
     *
     * @param exposure the exposure to assess
     * @param macroContext the macroeconomic snapshot
     * @param scenario the scenario whose multiplier adjusts the PD
     * @return the resulting {@link EclResult}
     */
    EclResult classifyAndQuantify(Exposure exposure, MacroContext macroContext, Scenario scenario);
}
