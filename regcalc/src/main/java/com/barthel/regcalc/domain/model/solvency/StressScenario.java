package com.barthel.regcalc.domain.model.solvency;

import com.barthel.regcalc.domain.exception.InvalidInputException;

import java.math.BigDecimal;

/**
 * Relative shocks applied to own funds and minimum margin.
 */
public record StressScenario(String name, BigDecimal ownFundsShock, BigDecimal marginShock) {

    public StressScenario {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("Stress scenario needs a name");
        }
        if (ownFundsShock == null || marginShock == null) {
            throw new InvalidInputException(name + ": shocks are required");
        }
        if (marginShock.compareTo(BigDecimal.ONE.negate()) <= 0) {
            throw new InvalidInputException(name + ": margin shock must stay above -100%");
        }
    }
}
