package com.barthel.regcalc.domain.model.solvency;

/**
 * Licence class, selects the guaranteed fund minimum.
 */
public enum InsurerClass {
    LIFE,
    NON_LIFE,
    REINSURANCE
}
