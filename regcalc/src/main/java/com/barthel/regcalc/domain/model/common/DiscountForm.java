package com.barthel.regcalc.domain.model.common;

/**
 * Discount factor convention: {@code 1/(1+r)^t} or {@code exp(-r*t)}.
 */
public enum DiscountForm {
    DISCRETE,
    CONTINUOUS
}
