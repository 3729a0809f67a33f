package com.barthel.regcalc.domain.model.liability;

import com.barthel.regcalc.domain.exception.InvalidInputException;

import java.math.BigDecimal;

/**
 * Contractual service margin at initial recognition. At most one of
 * {@code csm} and {@code lossComponent} is positive.
 *
 * @param csm unearned profit
 * @param lossComponent loss recognised on an onerous group
 */
public record CsmResult(BigDecimal csm, BigDecimal lossComponent) {

    public CsmResult {
        if (csm.signum() < 0 || lossComponent.signum() < 0) {
            throw new InvalidInputException("CSM and loss component must not be negative");
        }
        if (csm.signum() > 0 && lossComponent.signum() > 0) {
            throw new InvalidInputException("CSM and loss component are mutually exclusive");
        }
    }

    public boolean onerous() {
        return lossComponent.signum() > 0;
    }
}
