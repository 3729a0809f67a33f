package com.barthel.regcalc.domain.model.solvency;

import com.barthel.regcalc.domain.exception.InvalidInputException;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Market participant covered by the policyholder guarantee fund.
 *
 * @param name insurer name
 * @param grossPremiums contribution base
 * @param reserves insurance reserves at risk on failure
 * @param probabilityOfDefault annual default probability
 * @param recoveryRate share of reserves recovered on failure
 * @param solvencyRatio current solvency ratio
 * @param lossRatio claims over premiums
 * @param combinedRatio claims and expenses over premiums
 * @param yearsInMarket years of operation
 */
@Builder
public record InsurerProfile(
        String name,
        BigDecimal grossPremiums,
        BigDecimal reserves,
        BigDecimal probabilityOfDefault,
        BigDecimal recoveryRate,
        BigDecimal solvencyRatio,
        BigDecimal lossRatio,
        BigDecimal combinedRatio,
        int yearsInMarket) {

    public InsurerProfile {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("Insurer name is required");
        }
        if (grossPremiums == null || grossPremiums.signum() < 0 || reserves == null || reserves.signum() < 0) {
            throw new InvalidInputException(name + ": premiums and reserves must be non-negative");
        }
        probabilityOfDefault = probability(name, "probabilityOfDefault", probabilityOfDefault, new BigDecimal("0.05"));
        recoveryRate = probability(name, "recoveryRate", recoveryRate, new BigDecimal("0.30"));
        solvencyRatio = solvencyRatio == null ? BigDecimal.ZERO : solvencyRatio;
        lossRatio = lossRatio == null ? BigDecimal.ONE : lossRatio;
        combinedRatio = combinedRatio == null ? BigDecimal.ONE : combinedRatio;
        if (yearsInMarket < 0) {
            throw new InvalidInputException(name + ": yearsInMarket must not be negative");
        }
    }

    private static BigDecimal probability(String name, String field, BigDecimal value, BigDecimal fallback) {
        if (value == null) {
            return fallback;
        }
        if (value.signum() < 0 || value.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidInputException(name + ": " + field + " must be within [0, 1]");
        }
        return value;
    }
}
