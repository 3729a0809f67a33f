package com.barthel.regcalc.application.service.liability;

import com.barthel.regcalc.application.port.in.MeasureLiabilityUseCase;
import com.barthel.regcalc.application.service.audit.AuditTrailRecorder;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.model.audit.RegulatoryReference;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.liability.BelResult;
import com.barthel.regcalc.domain.model.liability.CashFlowSchedule;
import com.barthel.regcalc.domain.model.liability.CsmResult;
import com.barthel.regcalc.domain.model.liability.LiabilityMeasurement;
import com.barthel.regcalc.domain.model.liability.MeasurementModel;
import com.barthel.regcalc.domain.model.liability.PaaResult;
import com.barthel.regcalc.domain.model.liability.RaMethod;
import com.barthel.regcalc.domain.model.liability.RaResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Premium allocation approach: {@code LRC = premiums - DAC - RA}. Acquisition
 * costs are expensed for coverage of one period or less, otherwise deferred
 * and amortised straight-line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PremiumAllocationMeasurementService implements MeasureLiabilityUseCase {

    private final GeneralModelMeasurementService generalModel;
    private final AuditTrailRecorder auditTrailRecorder;

    @Override
    public LiabilityMeasurement measure(CashFlowSchedule schedule, BigDecimal acquisitionCosts, RaMethod raMethod,
                                        MeasurementModel model, MacroContext macroContext) {
        GeneralModelMeasurementService.requireInputs(schedule, acquisitionCosts, raMethod, macroContext);
        Rounding rounding = generalModel.rounding();

        BelResult bel = generalModel.bestEstimate(schedule, macroContext);
        RaResult ra = generalModel.riskAdjustment(schedule, raMethod, bel);

        int coveragePeriods = schedule.term();
        BigDecimal acquisition = rounding.money(acquisitionCosts);
        BigDecimal dac = coveragePeriods <= 1 ? rounding.zeroMoney() : acquisition;
        BigDecimal expensed = coveragePeriods <= 1 ? acquisition : rounding.zeroMoney();
        BigDecimal premiums = rounding.money(schedule.totalPremiums());
        BigDecimal lrc = premiums.subtract(dac).subtract(ra.riskAdjustment());

        PaaResult paa = new PaaResult(premiums, dac, expensed, ra.riskAdjustment(), lrc,
                amortisation(dac, coveragePeriods, rounding));
        BigDecimal fulfilment = bel.bel().add(ra.riskAdjustment());
        LiabilityMeasurement measurement = new LiabilityMeasurement(schedule.groupId(), MeasurementModel.PAA,
                MeasurementModel.PAA, bel, ra, new CsmResult(rounding.zeroMoney(), rounding.zeroMoney()), paa,
                fulfilment, lrc);

        auditTrailRecorder.record("Liability measurement PAA",
                List.of(schedule, acquisitionCosts, raMethod, macroContext), measurement,
                RegulatoryReference.IFRS_17_PAA);
        log.info("Measured {} model=PAA premiums={} dac={} ra={} lrc={}", schedule.groupId(), premiums, dac,
                ra.riskAdjustment(), lrc);
        return measurement;
    }

    @Override
    public boolean supports(MeasurementModel model) {
        return model == MeasurementModel.PAA;
    }

    private List<BigDecimal> amortisation(BigDecimal dac, int periods, Rounding rounding) {
        if (dac.signum() == 0) {
            return List.of();
        }
        BigDecimal instalment = dac.divide(BigDecimal.valueOf(periods), rounding.currencyScale(), RoundingMode.DOWN);
        List<BigDecimal> schedule = new ArrayList<>(periods);
        for (int t = 1; t < periods; t++) {
            schedule.add(instalment);
        }
        schedule.add(dac.subtract(instalment.multiply(BigDecimal.valueOf(periods - 1))));
        return schedule;
    }
}
