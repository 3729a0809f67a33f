package com.barthel.regcalc.domain.model.liability;

import java.math.BigDecimal;
import java.util.List;

/**
 * Premium allocation approach measurement of the liability for remaining coverage.
 *
 * @param premiums premiums received
 * @param deferredAcquisitionCosts DAC at inception, zero when expensed
 * @param acquisitionCostsExpensed acquisition costs expensed immediately
 * @param riskAdjustment RA deducted
 * @param liabilityForRemainingCoverage {@code premiums - DAC - RA}
 * @param dacAmortization straight-line DAC amortisation per coverage period
 */
public record PaaResult(
        BigDecimal premiums,
        BigDecimal deferredAcquisitionCosts,
        BigDecimal acquisitionCostsExpensed,
        BigDecimal riskAdjustment,
        BigDecimal liabilityForRemainingCoverage,
        List<BigDecimal> dacAmortization) {

    public PaaResult {
        dacAmortization = List.copyOf(dacAmortization);
    }
}
