package com.barthel.regcalc.application.port.out;

import com.barthel.regcalc.domain.model.common.MacroContext;

import java.math.BigDecimal;

/**
 * Port for resolving the risk-free rate of a tenor.
 */
public interface FetchRiskFreeRatePort {
    /**
     * Fetch the annual risk-free rate for the given tenor.
     *
     * @param macroContext the macroeconomic snapshot
     * @param tenor term in periods
     * @return the rate as a decimal fraction
     */
    BigDecimal fetchRiskFreeRate(MacroContext macroContext, int tenor);
}
