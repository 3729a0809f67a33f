package com.barthel.regcalc.application.service.credit;

import com.barthel.regcalc.application.port.in.ClassifyAndQuantifyEclUseCase;
import com.barthel.regcalc.application.service.audit.AuditTrailRecorder;
import com.barthel.regcalc.config.CreditRiskProperties;
import com.barthel.regcalc.domain.calc.Discounting;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.audit.RegulatoryReference;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.common.Scenario;
import com.barthel.regcalc.domain.model.credit.EclPeriod;
import com.barthel.regcalc.domain.model.credit.EclResult;
import com.barthel.regcalc.domain.model.credit.Exposure;
import com.barthel.regcalc.domain.model.credit.ImpairmentStage;
import com.barthel.regcalc.domain.model.credit.StageAssessment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Stages an exposure and aggregates its discounted expected loss over the
 * 12-month (stage 1) or lifetime (stages 2 and 3) horizon.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EclCalculationService implements ClassifyAndQuantifyEclUseCase {

    private final StageClassifier stageClassifier;
    private final CreditRiskParameters parameters;
    private final CreditRiskProperties properties;
    private final Rounding rounding;
    private final AuditTrailRecorder auditTrailRecorder;

    @Override
    public EclResult classifyAndQuantify(Exposure exposure, MacroContext macroContext, Scenario scenario) {
        if (exposure == null || macroContext == null || scenario == null) {
            throw new InvalidInputException("Exposure, macro context and scenario are required");
        }
        StageAssessment assessment = stageClassifier.classify(exposure);
        EclResult result = quantify(exposure, assessment.stage(), macroContext, scenario);
        auditTrailRecorder.record("ECL calculation", List.of(exposure, macroContext, scenario), result,
                RegulatoryReference.IFRS_9);
        log.info("ECL {} stage={} triggers={} ecl={}", exposure.id(), assessment.stage().number(),
                assessment.triggers(), result.ecl());
        return result;
    }

    /**
     * Loss for a given stage, without classification or audit.
     */
    public EclResult quantify(Exposure exposure, ImpairmentStage stage, MacroContext macroContext, Scenario scenario) {
        BigDecimal ead = parameters.exposureAtDefault(exposure);
        BigDecimal pd = parameters.adjustedPd(exposure, macroContext, scenario);
        BigDecimal lgd = parameters.adjustedLgd(exposure, ead, macroContext);

        int term = Math.max(1, exposure.remainingTerm());
        int horizon = stage.isLifetime() ? term : 1;
        BigDecimal survival = BigDecimal.ONE.subtract(pd);
        BigDecimal termDecimal = BigDecimal.valueOf(term);

        List<EclPeriod> periods = new ArrayList<>(horizon);
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal eadSum = BigDecimal.ZERO;
        for (int t = 1; t <= horizon; t++) {
            BigDecimal marginalPd = pd.multiply(survival.pow(t - 1, Rounding.WORKING), Rounding.WORKING);
            BigDecimal runDown = BigDecimal.ONE.subtract(
                    BigDecimal.valueOf(t - 1).divide(termDecimal, Rounding.WORKING));
            BigDecimal periodEad = ead.multiply(runDown);
            BigDecimal discountFactor = Discounting.discrete(exposure.effectiveInterestRate(), t);
            BigDecimal loss = marginalPd.multiply(lgd).multiply(periodEad).multiply(discountFactor, Rounding.WORKING);

            total = total.add(loss);
            BigDecimal roundedEad = rounding.money(periodEad);
            eadSum = eadSum.add(roundedEad);
            periods.add(new EclPeriod(t, rounding.ratio(marginalPd), roundedEad,
                    rounding.ratio(discountFactor), rounding.money(loss)));
            log.debug("ECL {} t={} pd={} ead={} df={} loss={}", exposure.id(), t, marginalPd, periodEad,
                    discountFactor, loss);
        }

        BigDecimal uplift = stage == ImpairmentStage.STAGE_3 ? stageThreeUplift(exposure) : BigDecimal.ONE;
        BigDecimal ecl = rounding.money(total.multiply(uplift)).min(eadSum);

        return new EclResult(exposure.id(), stage, scenario, pd, lgd, rounding.money(ead), horizon, periods,
                uplift, ecl);
    }

    private BigDecimal stageThreeUplift(Exposure exposure) {
        int cutoff = properties.getStaging().getStageThreeDaysPastDue();
        BigDecimal daysShare = cutoff == 0
                ? BigDecimal.ONE
                : rounding.divide(BigDecimal.valueOf(exposure.daysPastDue()), BigDecimal.valueOf(cutoff))
                        .min(BigDecimal.ONE);
        return BigDecimal.ONE.add(properties.getStageThreeUplift().multiply(daysShare));
    }
}
