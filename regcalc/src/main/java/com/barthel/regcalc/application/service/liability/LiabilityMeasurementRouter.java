package com.barthel.regcalc.application.service.liability;

import com.barthel.regcalc.application.port.in.MeasureLiabilityUseCase;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.liability.CashFlowSchedule;
import com.barthel.regcalc.domain.model.liability.LiabilityMeasurement;
import com.barthel.regcalc.domain.model.liability.MeasurementModel;
import com.barthel.regcalc.domain.model.liability.RaMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Facade routing a measurement to the service of the requested model.
 */
@Service
@RequiredArgsConstructor
@Primary
public class LiabilityMeasurementRouter implements MeasureLiabilityUseCase {

    private final List<MeasureLiabilityUseCase> implementations;

    @Override
    public LiabilityMeasurement measure(CashFlowSchedule schedule, BigDecimal acquisitionCosts, RaMethod raMethod,
                                        MeasurementModel model, MacroContext macroContext) {
        return implementations.stream()
                .filter(i -> i.supports(model))
                .findFirst()
                .orElseThrow(() -> new UnsupportedOperationException("No handler for measurement model: " + model))
                .measure(schedule, acquisitionCosts, raMethod, model, macroContext);
    }

    @Override
    public boolean supports(MeasurementModel model) {
        // routing only
        return false;
    }
}
