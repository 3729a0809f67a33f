package com.barthel.regcalc.domain.model.liability;

import com.barthel.regcalc.domain.exception.InvalidInputException;

import java.math.BigDecimal;

/**
 * Risk adjustment for non-financial risk.
 * <p>
 * For the simulation methods {@code expectedValue} is the mean simulated total
 * and {@code tailValue} the quantile (VaR) or tail mean (TVaR, CTE). For the
 * cost-of-capital method {@code expectedValue} is the capital requirement and
 * {@code tailValue} its present value.
 *
 * @param method technique used
 * @param confidenceLevel confidence level, 0.995 implied for cost of capital
 * @param simulations number of Monte-Carlo draws, zero for cost of capital
 * @param expectedValue see above
 * @param tailValue see above
 * @param riskAdjustment non-negative RA at currency precision
 */
public record RaResult(
        RaMethod method,
        BigDecimal confidenceLevel,
        int simulations,
        BigDecimal expectedValue,
        BigDecimal tailValue,
        BigDecimal riskAdjustment) {

    public RaResult {
        if (riskAdjustment.signum() < 0) {
            throw new InvalidInputException("Risk adjustment must not be negative");
        }
    }
}
