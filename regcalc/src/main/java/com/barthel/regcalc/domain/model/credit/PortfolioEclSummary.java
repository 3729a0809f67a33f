package com.barthel.regcalc.domain.model.credit;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Portfolio-level ECL with per-stage subtotals. Failed items are reported
 * separately and excluded from every total.
 *
 * @param results per-exposure results, in input order
 * @param failures isolated item failures
 * @param totalEcl sum of ECL
 * @param totalGrossCarryingAmount sum of GCA over successful items
 * @param eclByStage ECL subtotal per stage
 * @param countByStage item count per stage
 * @param coverageRatio {@code totalEcl / totalGrossCarryingAmount}, zero when there is no GCA
 */
public record PortfolioEclSummary(
        List<EclResult> results,
        List<ExposureFailure> failures,
        BigDecimal totalEcl,
        BigDecimal totalGrossCarryingAmount,
        Map<ImpairmentStage, BigDecimal> eclByStage,
        Map<ImpairmentStage, Integer> countByStage,
        BigDecimal coverageRatio) {

    public PortfolioEclSummary {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
        eclByStage = Collections.unmodifiableMap(new EnumMap<>(eclByStage));
        countByStage = Collections.unmodifiableMap(new EnumMap<>(countByStage));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
