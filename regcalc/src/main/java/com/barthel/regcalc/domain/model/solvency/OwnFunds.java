package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;

/**
 * Eligible own funds (FMP).
 *
 * @param base equity less deductions plus the CSM adjustment
 * @param subordinatedCap eligible ceiling for subordinated debt
 * @param subordinatedIncluded subordinated debt counted
 * @param subordinatedExcess subordinated debt above the cap, excluded
 * @param repoPenalty repo penalty deducted
 * @param amount final own funds
 */
public record OwnFunds(
        BigDecimal base,
        BigDecimal subordinatedCap,
        BigDecimal subordinatedIncluded,
        BigDecimal subordinatedExcess,
        BigDecimal repoPenalty,
        BigDecimal amount) {
}
