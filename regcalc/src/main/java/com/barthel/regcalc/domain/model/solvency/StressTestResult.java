package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param baseRatio unstressed ratio
 * @param scenarios ratio per deterministic scenario, in configured order
 * @param simulations Monte-Carlo draws
 * @param tailQuantile quantile level of the simulated ratio, e.g. 0.005
 * @param tailRatio simulated ratio at {@code tailQuantile}
 */
public record StressTestResult(
        BigDecimal baseRatio,
        List<StressedRatio> scenarios,
        int simulations,
        BigDecimal tailQuantile,
        BigDecimal tailRatio) {

    public StressTestResult {
        scenarios = List.copyOf(scenarios);
    }
}
