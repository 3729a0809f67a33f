package com.barthel.regcalc.domain.model.liability;

import com.barthel.regcalc.domain.exception.InvalidInputException;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Contract data the coverage-unit patterns draw on. Unset fields take the
 * defaults of a standard life contract.
 *
 * @param sumInsured benefit amount
 * @param mortalityRate per-period mortality
 * @param lapseRate per-period lapse
 * @param expectedReturn per-period investment return of the account value
 * @param premiumPattern explicit units per period, {@code null} for uniform
 */
@Builder
public record CoverageUnitsBasis(
        BigDecimal sumInsured,
        BigDecimal mortalityRate,
        BigDecimal lapseRate,
        BigDecimal expectedReturn,
        List<BigDecimal> premiumPattern) {

    public CoverageUnitsBasis {
        sumInsured = sumInsured == null ? new BigDecimal("1000000") : sumInsured;
        mortalityRate = mortalityRate == null ? new BigDecimal("0.001") : mortalityRate;
        lapseRate = lapseRate == null ? new BigDecimal("0.05") : lapseRate;
        expectedReturn = expectedReturn == null ? new BigDecimal("0.08") : expectedReturn;
        if (sumInsured.signum() < 0) {
            throw new InvalidInputException("Sum insured must not be negative");
        }
        if (outsideUnit(mortalityRate) || outsideUnit(lapseRate)) {
            throw new InvalidInputException("Mortality and lapse rates must be within [0, 1]");
        }
        if (premiumPattern != null) {
            if (premiumPattern.stream().anyMatch(u -> u == null || u.signum() < 0)) {
                throw new InvalidInputException("Premium pattern units must be non-negative");
            }
            premiumPattern = List.copyOf(premiumPattern);
        }
    }

    private static boolean outsideUnit(BigDecimal rate) {
        return rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0;
    }
}
