package com.barthel.regcalc.application.port.in;

import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.common.Scenario;
import com.barthel.regcalc.domain.model.credit.Exposure;
import com.barthel.regcalc.domain.model.credit.PortfolioEclSummary;

import java.util.List;

/**
 * Use case for computing ECL over a portfolio with per-item failure isolation.
 */
public interface AggregatePortfolioEclUseCase {
    /**
     * Computes ECL for every exposure and sums the results.
     *
     * @param exposures the portfolio
     * @param macroContext the macroeconomic snapshot
     * @param scenario the scenario applied to every exposure
     * @return totals, per-stage subtotals and isolated failures
     */
    PortfolioEclSummary aggregate(List<Exposure> exposures, MacroContext macroContext, Scenario scenario);
}
