package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;

/**
 * @param equity equity holdings
 * @param property property holdings
 * @param interestRateSensitivity value at risk from an upward rate move
 * @param spread spread-sensitive holdings
 */
public record MarketRiskExposure(BigDecimal equity, BigDecimal property, BigDecimal interestRateSensitivity, BigDecimal spread) {
}
