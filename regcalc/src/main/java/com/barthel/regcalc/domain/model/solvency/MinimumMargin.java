package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;

/**
 * Required minimum solvency margin (MMP).
 *
 * @param byPremiums tiered premium-based margin times K
 * @param byClaims tiered claims-based margin times K
 * @param base {@code max(byPremiums, byClaims)}
 * @param lifeAddon annuity and mathematical reserve addon
 * @param compulsoryLoading proportional loading for compulsory lines
 * @param guaranteedFund absolute floor for the licence class
 * @param amount final margin
 * @param floorApplied true when the guaranteed fund set the amount
 */
public record MinimumMargin(
        BigDecimal byPremiums,
        BigDecimal byClaims,
        BigDecimal base,
        BigDecimal lifeAddon,
        BigDecimal compulsoryLoading,
        BigDecimal guaranteedFund,
        BigDecimal amount,
        boolean floorApplied) {
}
