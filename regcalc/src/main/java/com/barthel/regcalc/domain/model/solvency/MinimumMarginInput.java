package com.barthel.regcalc.domain.model.solvency;

import com.barthel.regcalc.domain.exception.InvalidInputException;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Bases of the minimum margin calculation.
 *
 * @param insurerClass licence class
 * @param grossPremiums premium base
 * @param incurredClaims claims base
 * @param correctionCoefficient K, {@code null} takes the configured default
 * @param annuityReserves annuity reserves for the life addon
 * @param mathematicalReserves mathematical reserves for the life addon
 * @param compulsoryLines compulsory lines written, adds the proportional loading
 */
@Builder
public record MinimumMarginInput(
        InsurerClass insurerClass,
        BigDecimal grossPremiums,
        BigDecimal incurredClaims,
        BigDecimal correctionCoefficient,
        BigDecimal annuityReserves,
        BigDecimal mathematicalReserves,
        boolean compulsoryLines) {

    public MinimumMarginInput {
        insurerClass = insurerClass == null ? InsurerClass.NON_LIFE : insurerClass;
        grossPremiums = nonNegative("grossPremiums", grossPremiums);
        incurredClaims = nonNegative("incurredClaims", incurredClaims);
        annuityReserves = nonNegative("annuityReserves", annuityReserves);
        mathematicalReserves = nonNegative("mathematicalReserves", mathematicalReserves);
    }

    public boolean hasLifeReserves() {
        return annuityReserves.signum() > 0 || mathematicalReserves.signum() > 0;
    }

    private static BigDecimal nonNegative(String field, BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() < 0) {
            throw new InvalidInputException(field + " must not be negative");
        }
        return value;
    }
}
