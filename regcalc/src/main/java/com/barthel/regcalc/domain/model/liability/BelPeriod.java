package com.barthel.regcalc.domain.model.liability;

import java.math.BigDecimal;

/**
 * @param period 1-based period
 * @param netCashFlow claims + expenses + acquisition costs - premiums
 * @param survivalFactor {@code (1 - lapse)^(t-1)}
 * @param discountFactor discount factor at the resolved rate
 * @param presentValue discounted, survival-weighted contribution
 */
public record BelPeriod(
        int period,
        BigDecimal netCashFlow,
        BigDecimal survivalFactor,
        BigDecimal discountFactor,
        BigDecimal presentValue) {
}
