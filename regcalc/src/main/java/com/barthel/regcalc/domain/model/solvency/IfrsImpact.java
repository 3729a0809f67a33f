package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;

/**
 * Solvency before and after recognising ECL, CSM and BEL/RA effects.
 *
 * @param preOwnFunds own funds before
 * @param preMargin minimum margin before
 * @param preRatio ratio before
 * @param postOwnFunds {@code pre - ECL + CSM}
 * @param postMargin {@code pre - BEL/RA impact}
 * @param postRatio ratio after
 * @param ratioChangePoints change in percentage points
 */
public record IfrsImpact(
        BigDecimal preOwnFunds,
        BigDecimal preMargin,
        BigDecimal preRatio,
        BigDecimal postOwnFunds,
        BigDecimal postMargin,
        BigDecimal postRatio,
        BigDecimal ratioChangePoints) {
}
