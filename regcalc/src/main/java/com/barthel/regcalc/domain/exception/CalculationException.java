package com.barthel.regcalc.domain.exception;

/**
 * Raised when inputs pass validation individually but are inconsistent
 * with each other, e.g. a correlation matrix that yields a negative
 * diversification benefit.
 */
public class CalculationException extends RuntimeException {

    public CalculationException(String message) {
        super(message);
    }
}
