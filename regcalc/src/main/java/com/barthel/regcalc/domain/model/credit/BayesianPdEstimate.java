package com.barthel.regcalc.domain.model.credit;

import java.math.BigDecimal;

/**
 * Beta-Binomial posterior PD.
 *
 * @param mean posterior mean
 * @param lower 2.5% posterior quantile
 * @param upper 97.5% posterior quantile
 * @param posteriorAlpha alpha of the Beta posterior
 * @param posteriorBeta beta of the Beta posterior
 */
public record BayesianPdEstimate(
        BigDecimal mean,
        BigDecimal lower,
        BigDecimal upper,
        double posteriorAlpha,
        double posteriorBeta) {
}
