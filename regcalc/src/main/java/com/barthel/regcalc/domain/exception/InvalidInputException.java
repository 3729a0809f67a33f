package com.barthel.regcalc.domain.exception;

/**
 * Raised when an input is structurally invalid or outside its domain
 * (negative PD, empty cash-flow schedule, asymmetric correlation matrix).
 * Always thrown before any computation starts.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
