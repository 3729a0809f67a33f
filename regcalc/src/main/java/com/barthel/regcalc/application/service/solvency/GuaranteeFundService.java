package com.barthel.regcalc.application.service.solvency;

import com.barthel.regcalc.application.service.audit.AuditTrailRecorder;
import com.barthel.regcalc.config.GuaranteeFundProperties;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.calc.SampleStatistics;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.audit.RegulatoryReference;
import com.barthel.regcalc.domain.model.solvency.BankruptcySimulation;
import com.barthel.regcalc.domain.model.solvency.GuaranteeFundAssessment;
import com.barthel.regcalc.domain.model.solvency.GuaranteeFundContribution;
import com.barthel.regcalc.domain.model.solvency.InsurerProfile;
import com.barthel.regcalc.domain.model.solvency.RiskClass;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Policyholder guarantee fund: risk-based contributions and a correlated
 * default simulation of the claims the fund would have to meet.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GuaranteeFundService {

    private static final BigDecimal TWO = new BigDecimal("2.0");
    private static final BigDecimal ONE_AND_HALF = new BigDecimal("1.5");
    private static final BigDecimal LOW_LOSS_RATIO = new BigDecimal("0.60");
    private static final BigDecimal MODERATE_LOSS_RATIO = new BigDecimal("0.75");
    private static final BigDecimal LOW_COMBINED_RATIO = new BigDecimal("0.90");

    private final GuaranteeFundProperties properties;
    private final Rounding rounding;
    private final AuditTrailRecorder auditTrailRecorder;

    public GuaranteeFundAssessment assess(List<InsurerProfile> insurers) {
        List<GuaranteeFundContribution> contributions = insurers.stream().map(this::contribution).toList();
        BigDecimal total = contributions.stream()
                .map(GuaranteeFundContribution::amount)
                .reduce(rounding.zeroMoney(), BigDecimal::add);
        GuaranteeFundAssessment assessment = new GuaranteeFundAssessment(contributions, total,
                simulate(insurers, properties.getDefaultCorrelation()));
        auditTrailRecorder.record("Guarantee fund assessment", insurers, assessment,
                RegulatoryReference.GUARANTEE_FUND);
        return assessment;
    }

    /**
     * Scores solvency (up to 3), loss ratio (2), combined ratio (2) and
     * market tenure (1); 7 and above is low risk, 4 and above medium.
     */
    public int score(InsurerProfile insurer) {
        int score = 0;
        if (insurer.solvencyRatio().compareTo(TWO) >= 0) {
            score += 3;
        } else if (insurer.solvencyRatio().compareTo(ONE_AND_HALF) >= 0) {
            score += 2;
        } else if (insurer.solvencyRatio().compareTo(BigDecimal.ONE) >= 0) {
            score += 1;
        }
        if (insurer.lossRatio().compareTo(LOW_LOSS_RATIO) < 0) {
            score += 2;
        } else if (insurer.lossRatio().compareTo(MODERATE_LOSS_RATIO) < 0) {
            score += 1;
        }
        if (insurer.combinedRatio().compareTo(LOW_COMBINED_RATIO) < 0) {
            score += 2;
        } else if (insurer.combinedRatio().compareTo(BigDecimal.ONE) < 0) {
            score += 1;
        }
        if (insurer.yearsInMarket() >= 10) {
            score += 1;
        }
        return score;
    }

    public RiskClass riskClass(int score) {
        if (score >= 7) {
            return RiskClass.LOW_RISK;
        }
        return score >= 4 ? RiskClass.MEDIUM_RISK : RiskClass.HIGH_RISK;
    }

    public GuaranteeFundContribution contribution(InsurerProfile insurer) {
        int score = score(insurer);
        RiskClass riskClass = riskClass(score);
        BigDecimal rate = properties.getContributionRates().get(riskClass);
        return new GuaranteeFundContribution(insurer.name(), score, riskClass, rate,
                rounding.money(insurer.grossPremiums().multiply(rate)));
    }

    /**
     * One-factor Gaussian copula with equicorrelation {@code correlation}:
     * insurer {@code i} fails when {@code sqrt(rho) M + sqrt(1 - rho) e_i}
     * falls below {@code N^-1(PD_i)}, costing its unrecovered reserves.
     * An empty market yields {@link BankruptcySimulation#empty()}.
     */
    public BankruptcySimulation simulate(List<InsurerProfile> insurers, double correlation) {
        if (insurers.isEmpty()) {
            return BankruptcySimulation.empty();
        }
        if (correlation < 0 || correlation >= 1) {
            throw new InvalidInputException("Default correlation must be within [0, 1)");
        }
        int n = insurers.size();
        NormalDistribution standardNormal = new NormalDistribution();
        double[] thresholds = new double[n];
        double[] losses = new double[n];
        double totalReserves = 0;
        for (int i = 0; i < n; i++) {
            InsurerProfile insurer = insurers.get(i);
            thresholds[i] = standardNormal.inverseCumulativeProbability(insurer.probabilityOfDefault().doubleValue());
            losses[i] = insurer.reserves().doubleValue() * (1.0 - insurer.recoveryRate().doubleValue());
            totalReserves += insurer.reserves().doubleValue();
        }

        int draws = Math.min(Math.max(properties.getSimulations(), 1), properties.getMaxSimulations());
        double systematicWeight = Math.sqrt(correlation);
        double idiosyncraticWeight = Math.sqrt(1.0 - correlation);
        RandomGenerator random = new Well19937c(properties.getSeed());
        double assumedFund = totalReserves * properties.getFundShareOfReserves().doubleValue();

        double[] claims = new double[draws];
        int shortfalls = 0;
        for (int s = 0; s < draws; s++) {
            double market = random.nextGaussian();
            double claim = 0;
            for (int i = 0; i < n; i++) {
                double latent = systematicWeight * market + idiosyncraticWeight * random.nextGaussian();
                if (latent < thresholds[i]) {
                    claim += losses[i];
                }
            }
            claims[s] = claim;
            if (claim > assumedFund) {
                shortfalls++;
            }
        }

        double expected = SampleStatistics.mean(claims);
        BigDecimal fund = rounding.money(assumedFund);
        BigDecimal adequacy = expected > 0
                ? rounding.ratio(assumedFund / expected)
                : properties.getAdequacyWithoutClaims();
        BankruptcySimulation simulation = new BankruptcySimulation(
                draws,
                rounding.money(expected),
                rounding.money(SampleStatistics.quantile(claims, 0.95)),
                rounding.money(SampleStatistics.quantile(claims, 0.99)),
                fund,
                rounding.ratio((double) shortfalls / draws),
                adequacy,
                adequacy.compareTo(properties.getAdequacyRatio()) >= 0);
        log.info("Guarantee fund simulation insurers={} draws={} expected={} p(shortfall)={}", n, draws,
                simulation.expectedClaims(), simulation.probabilityOfShortfall());
        return simulation;
    }
}
