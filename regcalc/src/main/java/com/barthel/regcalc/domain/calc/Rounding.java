package com.barthel.regcalc.domain.calc;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Single rounding policy shared by the credit, liability and solvency engines.
 * Currency amounts are quantized to {@code currencyScale} decimals, ratios and
 * rates to {@code ratioScale} decimals, both with the same rounding mode.
 *
 * @param currencyScale decimals kept on currency amounts
 * @param ratioScale decimals kept on ratios, rates and probabilities
 * @param mode rounding mode applied everywhere
 */
public record Rounding(int currencyScale, int ratioScale, RoundingMode mode) {

    /** Precision used for intermediate arithmetic such as powers. */
    public static final MathContext WORKING = MathContext.DECIMAL128;

    private static final Rounding STANDARD = new Rounding(3, 10, RoundingMode.HALF_UP);

    public Rounding {
        if (currencyScale < 0 || ratioScale < currencyScale) {
            throw new IllegalArgumentException("Ratio scale must be >= currency scale >= 0");
        }
        if (mode == null || mode == RoundingMode.UNNECESSARY) {
            throw new IllegalArgumentException("A concrete rounding mode is required");
        }
    }

    /**
     * Three currency decimals, ten ratio decimals, half-up.
     */
    public static Rounding standard() {
        return STANDARD;
    }

    public BigDecimal money(BigDecimal value) {
        return value.setScale(currencyScale, mode);
    }

    public BigDecimal money(double value) {
        return money(BigDecimal.valueOf(value));
    }

    public BigDecimal ratio(BigDecimal value) {
        return value.setScale(ratioScale, mode);
    }

    public BigDecimal ratio(double value) {
        return ratio(BigDecimal.valueOf(value));
    }

    /**
     * Divides at ratio scale. Callers guard zero denominators themselves.
     */
    public BigDecimal divide(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, ratioScale, mode);
    }

    public BigDecimal zeroMoney() {
        return BigDecimal.ZERO.setScale(currencyScale, mode);
    }
}
