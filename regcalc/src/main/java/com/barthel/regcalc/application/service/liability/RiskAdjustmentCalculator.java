package com.barthel.regcalc.application.service.liability;

import com.barthel.regcalc.config.LiabilityProperties;
import com.barthel.regcalc.domain.calc.Discounting;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.calc.SampleStatistics;
import com.barthel.regcalc.domain.exception.CalculationException;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.common.DiscountForm;
import com.barthel.regcalc.domain.model.liability.CorrelationMatrix;
import com.barthel.regcalc.domain.model.liability.DiversifiedRiskAdjustment;
import com.barthel.regcalc.domain.model.liability.RaMethod;
import com.barthel.regcalc.domain.model.liability.RaResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Risk adjustment for non-financial risk.
 * <p>
 * The simulation methods draw the total net cash flow as a sum of per-period
 * normals fitted to the projected series. Each call seeds its own generator,
 * so equal inputs give equal results and concurrent calls do not interfere.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RiskAdjustmentCalculator {

    private static final BigDecimal COC_CONFIDENCE = new BigDecimal("0.995");
    private static final double SINGLE_PERIOD_VOLATILITY = 0.1;

    private final LiabilityProperties properties;
    private final Rounding rounding;

    /**
     * @param method technique
     * @param netOutflows projected net outflow per period
     * @param bel best estimate, base of the run-off capital for cost of capital
     * @param rate discount rate for cost of capital
     * @param form discount convention for cost of capital
     */
    public RaResult calculate(RaMethod method, List<BigDecimal> netOutflows, BigDecimal bel, BigDecimal rate,
                              DiscountForm form) {
        if (netOutflows == null || netOutflows.isEmpty()) {
            throw new InvalidInputException("Risk adjustment needs at least one projected cash flow");
        }
        return switch (method) {
            case VAR -> valueAtRisk(netOutflows);
            case TVAR -> tailValueAtRisk(netOutflows);
            case CTE -> conditionalTailExpectation(netOutflows);
            case COC -> costOfCapital(defaultCapital(bel), netOutflows.size(), rate, form);
        };
    }

    /**
     * {@code max(0, quantile(confidence) - mean)} of the simulated total.
     */
    public RaResult valueAtRisk(List<BigDecimal> netOutflows) {
        BigDecimal confidence = confidence(RaMethod.VAR);
        double[] totals = simulateTotals(netOutflows);
        double expected = SampleStatistics.mean(totals);
        double quantile = SampleStatistics.quantile(totals, confidence.doubleValue());
        return simulated(RaMethod.VAR, confidence, totals.length, expected, quantile);
    }

    /**
     * Mean of the draws at or above the VaR order statistic, less the mean.
     */
    public RaResult tailValueAtRisk(List<BigDecimal> netOutflows) {
        BigDecimal confidence = confidence(RaMethod.TVAR);
        double[] sorted = SampleStatistics.sorted(simulateTotals(netOutflows));
        double threshold = sorted[SampleStatistics.tailStart(sorted.length, confidence.doubleValue())];
        double sum = 0;
        int count = 0;
        for (double value : sorted) {
            if (value >= threshold) {
                sum += value;
                count++;
            }
        }
        return simulated(RaMethod.TVAR, confidence, sorted.length, SampleStatistics.mean(sorted), sum / count);
    }

    /**
     * Mean of the upper {@code 1 - confidence} order statistics, less the mean.
     */
    public RaResult conditionalTailExpectation(List<BigDecimal> netOutflows) {
        BigDecimal confidence = confidence(RaMethod.CTE);
        double[] sorted = SampleStatistics.sorted(simulateTotals(netOutflows));
        int start = SampleStatistics.tailStart(sorted.length, confidence.doubleValue());
        double sum = 0;
        for (int i = start; i < sorted.length; i++) {
            sum += sorted[i];
        }
        double tail = sum / (sorted.length - start);
        return simulated(RaMethod.CTE, confidence, sorted.length, SampleStatistics.mean(sorted), tail);
    }

    /**
     * {@code cocRate * sum_t capital * (1 - (t-1)/term) * DF_t}.
     */
    public RaResult costOfCapital(BigDecimal capital, int term, BigDecimal rate, DiscountForm form) {
        if (capital.signum() < 0) {
            throw new InvalidInputException("Capital requirement must not be negative");
        }
        if (term < 1) {
            throw new InvalidInputException("Cost-of-capital term must be at least one period");
        }
        BigDecimal termDecimal = BigDecimal.valueOf(term);
        BigDecimal presentValue = BigDecimal.ZERO;
        for (int t = 1; t <= term; t++) {
            BigDecimal runOff = BigDecimal.ONE.subtract(BigDecimal.valueOf(t - 1).divide(termDecimal, Rounding.WORKING));
            presentValue = presentValue.add(capital.multiply(runOff).multiply(Discounting.factor(form, rate, t)));
        }
        BigDecimal ra = rounding.money(properties.getRiskAdjustment().getCostOfCapitalRate().multiply(presentValue));
        return new RaResult(RaMethod.COC, COC_CONFIDENCE, 0, rounding.money(capital), rounding.money(presentValue), ra);
    }

    /**
     * {@code sqrt(sum_ij corr_ij * RA_i * RA_j)} over the components, keyed by
     * risk name in the order of the matrix.
     *
     * @throws CalculationException when the correlations produce a negative
     *                              radicand or a negative diversification benefit
     */
    public DiversifiedRiskAdjustment diversify(Map<String, BigDecimal> components, CorrelationMatrix matrix) {
        if (!matrix.risks().equals(new ArrayList<>(components.keySet()))) {
            throw new InvalidInputException("Correlation matrix risks " + matrix.risks()
                    + " do not match components " + components.keySet());
        }
        List<BigDecimal> values = new ArrayList<>(components.values());
        for (BigDecimal value : values) {
            if (value == null || value.signum() < 0) {
                throw new InvalidInputException("Risk adjustment components must be non-negative");
            }
        }
        BigDecimal radicand = BigDecimal.ZERO;
        for (int i = 0; i < values.size(); i++) {
            for (int j = 0; j < values.size(); j++) {
                radicand = radicand.add(matrix.get(i, j).multiply(values.get(i)).multiply(values.get(j)));
            }
        }
        if (radicand.signum() < 0) {
            throw new CalculationException("Correlation matrix yields a negative variance: " + radicand);
        }
        BigDecimal undiversified = rounding.money(values.stream().reduce(BigDecimal.ZERO, BigDecimal::add));
        BigDecimal diversified = rounding.money(radicand.sqrt(Rounding.WORKING));
        BigDecimal benefit = undiversified.subtract(diversified);
        if (benefit.signum() < 0) {
            throw new CalculationException("Negative diversification benefit " + benefit
                    + "; correlation inputs are inconsistent");
        }
        return new DiversifiedRiskAdjustment(undiversified, diversified, benefit);
    }

    /**
     * Matrix over {@code risks} from the configured pairwise correlations.
     */
    public CorrelationMatrix configuredCorrelations(List<String> risks) {
        LiabilityProperties.RiskAdjustment ra = properties.getRiskAdjustment();
        return CorrelationMatrix.fromPairs(risks, ra.getCorrelations(), ra.getDefaultCorrelation());
    }

    private BigDecimal defaultCapital(BigDecimal bel) {
        BigDecimal factor = properties.getRiskAdjustment().getCapitalFactor();
        return bel.multiply(factor).max(BigDecimal.ZERO);
    }

    private double[] simulateTotals(List<BigDecimal> netOutflows) {
        double[] flows = netOutflows.stream().mapToDouble(BigDecimal::doubleValue).toArray();
        double mean = SampleStatistics.mean(flows);
        double deviation = flows.length > 1
                ? SampleStatistics.populationStandardDeviation(flows)
                : Math.abs(mean) * SINGLE_PERIOD_VOLATILITY;

        LiabilityProperties.RiskAdjustment ra = properties.getRiskAdjustment();
        int draws = Math.min(Math.max(ra.getSimulations(), 1), ra.getMaxSimulations());
        RandomGenerator random = new Well19937c(ra.getSeed());
        double[] totals = new double[draws];
        for (int i = 0; i < draws; i++) {
            double total = 0;
            for (int j = 0; j < flows.length; j++) {
                total += mean + deviation * random.nextGaussian();
            }
            totals[i] = total;
        }
        return totals;
    }

    private RaResult simulated(RaMethod method, BigDecimal confidence, int draws, double expected, double tail) {
        BigDecimal ra = rounding.money(Math.max(0.0, tail - expected));
        log.debug("RA {} draws={} expected={} tail={} ra={}", method, draws, expected, tail, ra);
        return new RaResult(method, confidence, draws, rounding.money(expected), rounding.money(tail), ra);
    }

    private BigDecimal confidence(RaMethod method) {
        BigDecimal level = properties.getRiskAdjustment().getConfidenceLevels().get(method);
        if (level == null) {
            throw new InvalidInputException("No confidence level configured for " + method);
        }
        return level;
    }
}
