package com.barthel.regcalc.domain.model.liability;

import java.math.BigDecimal;

/**
 * @param undiversified sum of the component RAs
 * @param diversified {@code sqrt(sum_ij corr_ij * RA_i * RA_j)}
 * @param benefit {@code undiversified - diversified}, never negative
 */
public record DiversifiedRiskAdjustment(BigDecimal undiversified, BigDecimal diversified, BigDecimal benefit) {
}
