package com.barthel.regcalc.application.service.credit;

import com.barthel.regcalc.config.CreditRiskProperties;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.credit.BayesianPdEstimate;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Alternative PD and LGD estimators: Bayesian, macro-logistic, marginal
 * term structure and downturn LGD.
 */
@Service
@RequiredArgsConstructor
public class PdModelService {

    private static final BigDecimal PERCENT = BigDecimal.valueOf(100);

    private final CreditRiskProperties properties;
    private final Rounding rounding;

    /**
     * Beta-Binomial posterior of the default rate with a 95% credible interval.
     *
     * @param defaults observed defaults
     * @param observations observed exposures
     * @param priorAlpha alpha of the Beta prior
     * @param priorBeta beta of the Beta prior
     */
    public BayesianPdEstimate bayesian(int defaults, int observations, double priorAlpha, double priorBeta) {
        if (defaults < 0 || observations < defaults) {
            throw new InvalidInputException("Defaults must be within [0, observations]");
        }
        if (priorAlpha <= 0 || priorBeta <= 0) {
            throw new InvalidInputException("Beta prior parameters must be positive");
        }
        double alpha = defaults + priorAlpha;
        double beta = observations - defaults + priorBeta;
        BetaDistribution posterior = new BetaDistribution(alpha, beta);
        return new BayesianPdEstimate(
                rounding.ratio(alpha / (alpha + beta)),
                rounding.ratio(posterior.inverseCumulativeProbability(0.025)),
                rounding.ratio(posterior.inverseCumulativeProbability(0.975)),
                alpha,
                beta);
    }

    /**
     * Logistic PD from GDP growth and inflation of the context, both taken in percent.
     */
    public BigDecimal logistic(MacroContext macroContext) {
        CreditRiskProperties.LogisticPd model = properties.getLogisticPd();
        double gdp = macroContext.gdpGrowth().multiply(PERCENT).doubleValue();
        double inflation = macroContext.inflation().multiply(PERCENT).doubleValue();
        double logit = model.getIntercept() + model.getGdpCoefficient() * gdp + model.getInflationCoefficient() * inflation;
        return rounding.ratio(1.0 / (1.0 + Math.exp(-logit)));
    }

    /**
     * Marginal PDs {@code PD_t - PD_{t-1}} of a non-decreasing cumulative curve.
     */
    public List<BigDecimal> marginalFromCumulative(List<BigDecimal> cumulative) {
        if (cumulative == null || cumulative.isEmpty()) {
            throw new InvalidInputException("Cumulative PD curve must not be empty");
        }
        List<BigDecimal> marginal = new ArrayList<>(cumulative.size());
        BigDecimal previous = BigDecimal.ZERO;
        for (int i = 0; i < cumulative.size(); i++) {
            BigDecimal current = cumulative.get(i);
            if (current == null || current.compareTo(BigDecimal.ONE) > 0 || current.compareTo(previous) < 0) {
                throw new InvalidInputException("Cumulative PD at index " + i
                        + " must be non-decreasing and within [0, 1]");
            }
            marginal.add(rounding.ratio(current.subtract(previous)));
            previous = current;
        }
        return marginal;
    }

    /**
     * {@code min(1, averageLgd + sigma * z(confidence))}.
     */
    public BigDecimal downturnLgd(BigDecimal averageLgd, BigDecimal sigma, double confidence) {
        if (confidence <= 0 || confidence >= 1) {
            throw new InvalidInputException("Confidence must be within (0, 1)");
        }
        if (averageLgd.signum() < 0 || averageLgd.compareTo(BigDecimal.ONE) > 0 || sigma.signum() < 0) {
            throw new InvalidInputException("LGD must be within [0, 1] and its deviation non-negative");
        }
        double z = new NormalDistribution().inverseCumulativeProbability(confidence);
        BigDecimal downturn = averageLgd.add(sigma.multiply(BigDecimal.valueOf(z)));
        return rounding.ratio(downturn.min(BigDecimal.ONE));
    }
}
