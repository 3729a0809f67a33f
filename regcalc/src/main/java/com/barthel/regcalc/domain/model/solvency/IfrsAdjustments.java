package com.barthel.regcalc.domain.model.solvency;

import com.barthel.regcalc.domain.exception.InvalidInputException;

import java.math.BigDecimal;

/**
 * Own-funds adjustments produced by the credit and liability engines.
 *
 * @param ecl expected credit loss deducted from own funds
 * @param csm contractual service margin added back to own funds
 */
public record IfrsAdjustments(BigDecimal ecl, BigDecimal csm) {

    public static final IfrsAdjustments NONE = new IfrsAdjustments(BigDecimal.ZERO, BigDecimal.ZERO);

    public IfrsAdjustments {
        if (ecl == null || ecl.signum() < 0 || csm == null || csm.signum() < 0) {
            throw new InvalidInputException("ECL and CSM adjustments must be non-negative");
        }
    }
}
