package com.barthel.regcalc.domain.model.liability;

import com.barthel.regcalc.domain.model.common.DiscountForm;

import java.math.BigDecimal;
import java.util.List;

/**
 * Best estimate liability. Negative values represent a net asset.
 *
 * @param discountRate resolved annual rate
 * @param discountForm factor convention used
 * @param periods per-period breakdown
 * @param bel signed present value of net outflows at currency precision
 */
public record BelResult(BigDecimal discountRate, DiscountForm discountForm, List<BelPeriod> periods, BigDecimal bel) {
    public BelResult {
        periods = List.copyOf(periods);
    }
}
