package com.barthel.regcalc.domain.model.credit;

/**
 * Off-balance facility type driving the credit conversion factor.
 */
public enum FacilityType {
    CREDIT_LINE,
    GUARANTEE,
    LETTER_OF_CREDIT,
    UNUSED_LIMIT
}
