package com.barthel.regcalc.domain.model.credit;

import com.barthel.regcalc.domain.exception.InvalidInputException;

import java.math.BigDecimal;

/**
 * Collateral held against an exposure.
 *
 * @param type collateral category
 * @param value realisable value, zero when unknown
 */
public record Collateral(CollateralType type, BigDecimal value) {

    private static final Collateral NONE = new Collateral(CollateralType.UNSECURED, BigDecimal.ZERO);

    public Collateral {
        if (type == null) {
            throw new InvalidInputException("Collateral type is required");
        }
        if (value == null || value.signum() < 0) {
            throw new InvalidInputException("Collateral value must not be negative");
        }
    }

    public static Collateral none() {
        return NONE;
    }
}
