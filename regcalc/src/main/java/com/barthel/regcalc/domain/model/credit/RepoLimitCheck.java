package com.barthel.regcalc.domain.model.credit;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Outcome of the repo limit check on a valuation date.
 *
 * @param valuationDate date the limit was resolved for
 * @param ratio repo / reserves, {@code null} when there are no reserves
 * @param limit applicable limit
 * @param compliant ratio within the limit
 * @param excess ratio points above the limit, zero when compliant
 * @param penalty own-funds penalty for the excess
 */
public record RepoLimitCheck(
        LocalDate valuationDate,
        BigDecimal ratio,
        BigDecimal limit,
        boolean compliant,
        BigDecimal excess,
        BigDecimal penalty) {
}
