package com.barthel.regcalc.domain.model.liability;

/**
 * Risk-adjustment technique.
 */
public enum RaMethod {
    /** Quantile of simulated total net cash flow over its mean. */
    VAR,
    /** Mean beyond the quantile over the mean. */
    TVAR,
    /** Cost-of-capital rate times the present value of run-off capital. */
    COC,
    /** Conditional tail expectation, the order-statistic form of TVaR. */
    CTE
}
