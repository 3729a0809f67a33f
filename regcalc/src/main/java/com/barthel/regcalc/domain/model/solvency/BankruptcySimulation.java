package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;

/**
 * Correlated-default simulation of guarantee-fund claims.
 *
 * @param simulations draws performed, zero when there were no insurers
 * @param expectedClaims mean simulated fund claims
 * @param valueAtRisk95 95th percentile of fund claims
 * @param valueAtRisk99 99th percentile of fund claims
 * @param assumedFund fund assumed available, a share of total reserves
 * @param probabilityOfShortfall share of draws where claims exceed the fund
 * @param fundAdequacy {@code assumedFund / expectedClaims}
 * @param adequate adequacy at or above the required ratio
 */
public record BankruptcySimulation(
        int simulations,
        BigDecimal expectedClaims,
        BigDecimal valueAtRisk95,
        BigDecimal valueAtRisk99,
        BigDecimal assumedFund,
        BigDecimal probabilityOfShortfall,
        BigDecimal fundAdequacy,
        boolean adequate) {

    public static BankruptcySimulation empty() {
        return new BankruptcySimulation(0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, true);
    }

    public boolean isEmpty() {
        return simulations == 0;
    }
}
