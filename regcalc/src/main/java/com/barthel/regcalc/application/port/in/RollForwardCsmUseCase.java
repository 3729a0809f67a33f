package com.barthel.regcalc.application.port.in;

import com.barthel.regcalc.domain.model.liability.CsmMovement;
import com.barthel.regcalc.domain.model.liability.CsmRollForwardInput;

/**
 * Use case for moving a CSM balance from one reporting date to the next.
 */
public interface RollForwardCsmUseCase {
    /**
     * Applies accretion, adjustments and release to the opening balance.
     *
     * @param input the opening balance and period movements
     * @return the movement with the floored closing balance
     */
    CsmMovement rollForward(CsmRollForwardInput input);
}
