package com.barthel.regcalc.domain.model.liability;

/**
 * Pattern used to derive coverage units per period.
 */
public enum CoverageUnitsMethod {
    /** Sum insured weighted by cumulative survival. */
    QUANTITY,
    /** Expected policies in force after lapses. */
    EXPECTED_PERIOD,
    /** Account value growing at the expected return. */
    TIME_WEIGHTED,
    /** Supplied premium pattern, uniform when absent. */
    PREMIUM_PATTERN
}
