package com.barthel.regcalc.application.service.credit;

import com.barthel.regcalc.config.CreditRiskProperties;
import com.barthel.regcalc.domain.model.credit.CreditEvent;
import com.barthel.regcalc.domain.model.credit.Exposure;
import com.barthel.regcalc.domain.model.credit.ImpairmentStage;
import com.barthel.regcalc.domain.model.credit.StageAssessment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Assigns the impairment stage from the current facts of an exposure.
 * The stage is recomputed on every call and never depends on history.
 */
@Component
@RequiredArgsConstructor
public class StageClassifier {

    private static final Set<CreditEvent> QUALITATIVE_TRIGGERS =
            EnumSet.of(CreditEvent.RESTRUCTURING, CreditEvent.WATCHLIST, CreditEvent.COVENANT_BREACH);

    private final CreditRiskProperties properties;

    public StageAssessment classify(Exposure exposure) {
        CreditRiskProperties.Staging staging = properties.getStaging();

        List<String> impaired = new ArrayList<>();
        if (exposure.daysPastDue() > staging.getStageThreeDaysPastDue()) {
            impaired.add("days past due " + exposure.daysPastDue() + " > " + staging.getStageThreeDaysPastDue());
        }
        if (exposure.has(CreditEvent.DEFAULT_EVENT)) {
            impaired.add("default event");
        }
        if (!impaired.isEmpty()) {
            return new StageAssessment(ImpairmentStage.STAGE_3, impaired);
        }

        List<String> sicr = new ArrayList<>();
        if (exposure.daysPastDue() > staging.getStageTwoDaysPastDue()) {
            sicr.add("days past due " + exposure.daysPastDue() + " > " + staging.getStageTwoDaysPastDue());
        }
        BigDecimal pd = exposure.annualPd();
        BigDecimal origination = exposure.pdAtOrigination();
        if (origination.signum() > 0) {
            BigDecimal relative = pd.divide(origination, MathContext.DECIMAL64);
            if (relative.compareTo(staging.getPdRatioThreshold()) > 0) {
                sicr.add("PD ratio " + relative.stripTrailingZeros().toPlainString()
                        + " > " + staging.getPdRatioThreshold());
            }
        }
        BigDecimal absolute = pd.subtract(origination);
        if (absolute.compareTo(staging.getPdAbsoluteThreshold()) > 0) {
            sicr.add("PD increase " + absolute.toPlainString() + " > " + staging.getPdAbsoluteThreshold());
        }
        for (CreditEvent event : QUALITATIVE_TRIGGERS) {
            if (exposure.has(event)) {
                sicr.add(event.name().toLowerCase());
            }
        }
        return sicr.isEmpty()
                ? new StageAssessment(ImpairmentStage.STAGE_1, List.of())
                : new StageAssessment(ImpairmentStage.STAGE_2, sicr);
    }
}
