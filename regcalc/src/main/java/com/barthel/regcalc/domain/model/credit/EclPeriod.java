package com.barthel.regcalc.domain.model.credit;

import java.math.BigDecimal;

/**
 * Per-period component of an ECL measurement.
 *
 * @param period 1-based period
 * @param probabilityOfDefault marginal survival-weighted PD for the period
 * @param exposureAtDefault amortised EAD for the period
 * @param discountFactor discount factor at the effective rate
 * @param loss {@code PD_t * LGD * EAD_t * DF_t}, unrounded
 */
public record EclPeriod(
        int period,
        BigDecimal probabilityOfDefault,
        BigDecimal exposureAtDefault,
        BigDecimal discountFactor,
        BigDecimal loss) {
}
