package com.barthel.regcalc.application.service.liability;

import com.barthel.regcalc.application.port.in.MeasureLiabilityUseCase;
import com.barthel.regcalc.application.service.audit.AuditTrailRecorder;
import com.barthel.regcalc.config.LiabilityProperties;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.audit.RegulatoryReference;
import com.barthel.regcalc.domain.model.common.DiscountForm;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.liability.BelResult;
import com.barthel.regcalc.domain.model.liability.CashFlowSchedule;
import com.barthel.regcalc.domain.model.liability.CsmResult;
import com.barthel.regcalc.domain.model.liability.LiabilityMeasurement;
import com.barthel.regcalc.domain.model.liability.MeasurementModel;
import com.barthel.regcalc.domain.model.liability.RaMethod;
import com.barthel.regcalc.domain.model.liability.RaResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * General measurement model: BEL, RA and CSM or loss component.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeneralModelMeasurementService implements MeasureLiabilityUseCase {

    private final DiscountRateResolver discountRateResolver;
    private final BestEstimateCalculator bestEstimateCalculator;
    private final RiskAdjustmentCalculator riskAdjustmentCalculator;
    private final CsmCalculator csmCalculator;
    private final LiabilityProperties properties;
    private final Rounding rounding;
    private final AuditTrailRecorder auditTrailRecorder;

    @Override
    public LiabilityMeasurement measure(CashFlowSchedule schedule, BigDecimal acquisitionCosts, RaMethod raMethod,
                                        MeasurementModel model, MacroContext macroContext) {
        return measureWithMargin(schedule, acquisitionCosts, raMethod, macroContext, model, MeasurementModel.GMM);
    }

    @Override
    public boolean supports(MeasurementModel model) {
        return model == MeasurementModel.GMM;
    }

    LiabilityMeasurement measureWithMargin(CashFlowSchedule schedule, BigDecimal acquisitionCosts, RaMethod raMethod,
                                           MacroContext macroContext, MeasurementModel requested,
                                           MeasurementModel applied) {
        requireInputs(schedule, acquisitionCosts, raMethod, macroContext);
        BelResult bel = bestEstimate(schedule, macroContext);
        RaResult ra = riskAdjustment(schedule, raMethod, bel);
        CsmResult csm = csmCalculator.initialRecognition(schedule.totalPremiums(), acquisitionCosts, bel.bel(),
                ra.riskAdjustment());

        BigDecimal fulfilment = bel.bel().add(ra.riskAdjustment());
        BigDecimal total = fulfilment.add(csm.onerous() ? csm.lossComponent() : csm.csm());
        LiabilityMeasurement measurement = new LiabilityMeasurement(schedule.groupId(), requested, applied, bel, ra,
                csm, null, fulfilment, total);

        auditTrailRecorder.record("Liability measurement " + applied,
                List.of(schedule, acquisitionCosts, raMethod, requested, macroContext), measurement,
                RegulatoryReference.IFRS_17);
        log.info("Measured {} model={} bel={} ra={} csm={} loss={}", schedule.groupId(), applied, bel.bel(),
                ra.riskAdjustment(), csm.csm(), csm.lossComponent());
        return measurement;
    }

    BelResult bestEstimate(CashFlowSchedule schedule, MacroContext macroContext) {
        BigDecimal rate = discountRateResolver.resolve(macroContext, schedule.term());
        BigDecimal lapse = schedule.lapseRate() != null ? schedule.lapseRate() : properties.getDefaultLapseRate();
        return bestEstimateCalculator.calculate(schedule, lapse, rate, discountForm());
    }

    RaResult riskAdjustment(CashFlowSchedule schedule, RaMethod raMethod, BelResult bel) {
        return riskAdjustmentCalculator.calculate(raMethod, schedule.netOutflows(), bel.bel(), bel.discountRate(),
                bel.discountForm());
    }

    DiscountForm discountForm() {
        return properties.getDiscount().getForm();
    }

    Rounding rounding() {
        return rounding;
    }

    static void requireInputs(CashFlowSchedule schedule, BigDecimal acquisitionCosts, RaMethod raMethod,
                              MacroContext macroContext) {
        if (schedule == null || raMethod == null || macroContext == null) {
            throw new InvalidInputException("Schedule, RA method and macro context are required");
        }
        if (acquisitionCosts == null || acquisitionCosts.signum() < 0) {
            throw new InvalidInputException(schedule.groupId() + ": acquisition costs must be non-negative");
        }
    }
}
