package com.barthel.regcalc.domain.model.credit;

import com.barthel.regcalc.domain.model.common.Scenario;

import java.math.BigDecimal;
import java.util.List;

/**
 * Expected credit loss for one exposure.
 *
 * @param exposureId exposure identifier
 * @param stage impairment stage the loss was measured for
 * @param scenario macro scenario applied to the PD
 * @param adjustedPd scenario-adjusted annual PD
 * @param lgd adjusted LGD within [0, 1]
 * @param exposureAtDefault EAD at the start of the horizon
 * @param horizon number of periods measured
 * @param periods per-period breakdown
 * @param stageThreeUplift multiplicative days-on-default uplift, 1 outside stage 3
 * @param ecl total ECL at currency precision
 */
public record EclResult(
        String exposureId,
        ImpairmentStage stage,
        Scenario scenario,
        BigDecimal adjustedPd,
        BigDecimal lgd,
        BigDecimal exposureAtDefault,
        int horizon,
        List<EclPeriod> periods,
        BigDecimal stageThreeUplift,
        BigDecimal ecl) {

    public EclResult {
        periods = List.copyOf(periods);
    }

    public List<BigDecimal> pdVector() {
        return periods.stream().map(EclPeriod::probabilityOfDefault).toList();
    }

    public List<BigDecimal> eadVector() {
        return periods.stream().map(EclPeriod::exposureAtDefault).toList();
    }

    public List<BigDecimal> discountFactorVector() {
        return periods.stream().map(EclPeriod::discountFactor).toList();
    }

    /**
     * Upper bound of the ECL: the sum of the per-period EADs.
     */
    public BigDecimal totalExposureAtDefault() {
        return periods.stream().map(EclPeriod::exposureAtDefault).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
