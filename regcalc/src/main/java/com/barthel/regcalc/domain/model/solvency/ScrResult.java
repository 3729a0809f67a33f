package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;

/**
 * @param market market risk module
 * @param underwriting underwriting risk module
 * @param basic BSCR, square root of the sum of squared modules
 * @param operational operational risk, capped at a share of BSCR
 * @param total {@code basic + operational}
 */
public record ScrResult(BigDecimal market, BigDecimal underwriting, BigDecimal basic, BigDecimal operational, BigDecimal total) {
}
