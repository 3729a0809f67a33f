package com.barthel.regcalc.domain.calc;

import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.common.DiscountForm;

import java.math.BigDecimal;

/**
 * Discount factor arithmetic shared by the ECL and liability engines.
 * Rates passed to {@link #factor} are annual effective rates; the continuous
 * form converts them with {@link #continuousEquivalent} first, so both forms
 * give the same factor at the same rate.
 * <p>
 * Discrete factors are computed in {@link Rounding#WORKING}. The exponential
 * and logarithm go through {@code double}, about 16 significant digits,
 * which is well below the ratio scale factors are reported at.
 */
public final class Discounting {

    private Discounting() {
    }

    /**
     * {@code 1 / (1 + rate)^period}.
     */
    public static BigDecimal discrete(BigDecimal rate, int period) {
        requireValid(rate, period);
        BigDecimal growth = BigDecimal.ONE.add(rate).pow(period, Rounding.WORKING);
        return BigDecimal.ONE.divide(growth, Rounding.WORKING);
    }

    /**
     * {@code exp(-rate * period)} for a continuously compounded {@code rate}.
     */
    public static BigDecimal continuous(BigDecimal rate, int period) {
        requireValid(rate, period);
        return BigDecimal.valueOf(Math.exp(-rate.doubleValue() * period));
    }

    /**
     * Discount factor for an annual effective {@code rate} in the given form.
     */
    public static BigDecimal factor(DiscountForm form, BigDecimal rate, int period) {
        return switch (form) {
            case DISCRETE -> discrete(rate, period);
            case CONTINUOUS -> continuous(continuousEquivalent(rate), period);
        };
    }

    /**
     * Continuously compounded rate equivalent to an annual effective rate,
     * {@code ln(1 + rate)}. Discounting with it continuously reproduces the
     * discrete factors.
     */
    public static BigDecimal continuousEquivalent(BigDecimal annualRate) {
        if (annualRate == null || annualRate.compareTo(BigDecimal.ONE.negate()) <= 0) {
            throw new InvalidInputException("Rate must be greater than -1: " + annualRate);
        }
        return BigDecimal.valueOf(Math.log1p(annualRate.doubleValue()));
    }

    private static void requireValid(BigDecimal rate, int period) {
        if (rate == null || rate.compareTo(BigDecimal.ONE.negate()) <= 0) {
            throw new InvalidInputException("Discount rate must be greater than -1: " + rate);
        }
        if (period < 0) {
            throw new InvalidInputException("Period must not be negative: " + period);
        }
    }
}
