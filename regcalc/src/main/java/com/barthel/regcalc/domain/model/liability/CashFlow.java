package com.barthel.regcalc.domain.model.liability;

import com.barthel.regcalc.domain.exception.InvalidInputException;

import java.math.BigDecimal;

/**
 * Expected cash flows of a contract group for one period.
 *
 * @param period 1-based period index
 * @param premiums premium inflows
 * @param claims claim outflows
 * @param expenses maintenance expense outflows
 * @param acquisitionCosts acquisition cost outflows
 */
public record CashFlow(int period, BigDecimal premiums, BigDecimal claims, BigDecimal expenses, BigDecimal acquisitionCosts) {

    public CashFlow {
        if (period < 1) {
            throw new InvalidInputException("Cash-flow periods are 1-indexed, got " + period);
        }
        premiums = nonNegative("premiums", premiums);
        claims = nonNegative("claims", claims);
        expenses = nonNegative("expenses", expenses);
        acquisitionCosts = nonNegative("acquisitionCosts", acquisitionCosts);
    }

    /**
     * Outflows less inflows; positive means the period costs the insurer.
     */
    public BigDecimal netOutflow() {
        return claims.add(expenses).add(acquisitionCosts).subtract(premiums);
    }

    private static BigDecimal nonNegative(String field, BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() < 0) {
            throw new InvalidInputException(field + " must not be negative");
        }
        return value;
    }
}
