package com.barthel.regcalc.application.port.in;

import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.solvency.IfrsAdjustments;
import com.barthel.regcalc.domain.model.solvency.MinimumMarginInput;
import com.barthel.regcalc.domain.model.solvency.OwnFundsInput;
import com.barthel.regcalc.domain.model.solvency.SolvencyPosition;

/**
 * Use case for assessing capital adequacy.
 */
public interface AssessSolvencyUseCase {
    /**
     * Computes minimum margin, own funds, ratio and stress results.
     *
     * @param margin premium and claims bases
     * @param ownFunds balance-sheet items
     * @param adjustments ECL and CSM adjustments
     * @param macroContext the macroeconomic snapshot
     * @return the resulting {@link SolvencyPosition}
     */
    SolvencyPosition assess(MinimumMarginInput margin, OwnFundsInput ownFunds, IfrsAdjustments adjustments,
                            MacroContext macroContext);
}
