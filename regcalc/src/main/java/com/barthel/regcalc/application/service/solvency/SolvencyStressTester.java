package com.barthel.regcalc.application.service.solvency;

import com.barthel.regcalc.config.SolvencyProperties;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.calc.SampleStatistics;
import com.barthel.regcalc.domain.model.solvency.StressScenario;
import com.barthel.regcalc.domain.model.solvency.StressTestResult;
import com.barthel.regcalc.domain.model.solvency.StressedRatio;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Deterministic shock scenarios plus a Monte-Carlo tail of the solvency ratio.
 */
@Component
@RequiredArgsConstructor
public class SolvencyStressTester {

    private final SolvencyProperties properties;
    private final Rounding rounding;

    public StressTestResult stress(BigDecimal ownFunds, BigDecimal minimumMargin) {
        return stress(ownFunds, minimumMargin, properties.getStressScenarios());
    }

    public StressTestResult stress(BigDecimal ownFunds, BigDecimal minimumMargin, List<StressScenario> scenarios) {
        List<StressedRatio> stressed = scenarios.stream()
                .map(scenario -> {
                    BigDecimal funds = rounding.money(ownFunds.multiply(BigDecimal.ONE.add(scenario.ownFundsShock())));
                    BigDecimal margin = rounding.money(minimumMargin.multiply(BigDecimal.ONE.add(scenario.marginShock())));
                    BigDecimal ratio = ratio(funds, margin);
                    return new StressedRatio(scenario.name(), funds, margin, ratio, compliant(margin, ratio));
                })
                .toList();

        SolvencyProperties.MonteCarlo monteCarlo = properties.getMonteCarlo();
        int draws = Math.min(Math.max(monteCarlo.getSimulations(), 1), monteCarlo.getMaxSimulations());
        double tail = SampleStatistics.quantile(simulateRatios(ownFunds, minimumMargin, draws),
                monteCarlo.getTailQuantile());

        return new StressTestResult(ratio(ownFunds, minimumMargin), stressed, draws,
                BigDecimal.valueOf(monteCarlo.getTailQuantile()), rounding.ratio(tail));
    }

    BigDecimal ratio(BigDecimal ownFunds, BigDecimal minimumMargin) {
        return minimumMargin.signum() > 0
                ? rounding.divide(ownFunds, minimumMargin)
                : rounding.ratio(BigDecimal.ZERO);
    }

    static boolean compliant(BigDecimal minimumMargin, BigDecimal ratio) {
        return minimumMargin.signum() > 0 && ratio.compareTo(BigDecimal.ONE) >= 0;
    }

    private double[] simulateRatios(BigDecimal ownFunds, BigDecimal minimumMargin, int draws) {
        SolvencyProperties.MonteCarlo monteCarlo = properties.getMonteCarlo();
        RandomGenerator random = new Well19937c(monteCarlo.getSeed());
        double funds = ownFunds.doubleValue();
        double margin = minimumMargin.doubleValue();

        double[] simulatedFunds = new double[draws];
        for (int i = 0; i < draws; i++) {
            simulatedFunds[i] = funds + Math.abs(funds) * monteCarlo.getOwnFundsVolatility() * random.nextGaussian();
        }
        double[] ratios = new double[draws];
        for (int i = 0; i < draws; i++) {
            double simulatedMargin = margin + Math.abs(margin) * monteCarlo.getMarginVolatility() * random.nextGaussian();
            ratios[i] = simulatedFunds[i] / Math.max(simulatedMargin, 1.0);
        }
        return ratios;
    }
}
