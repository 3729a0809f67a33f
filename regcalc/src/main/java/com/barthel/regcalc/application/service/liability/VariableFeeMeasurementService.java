package com.barthel.regcalc.application.service.liability;

import com.barthel.regcalc.application.port.in.MeasureLiabilityUseCase;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.liability.CashFlowSchedule;
import com.barthel.regcalc.domain.model.liability.LiabilityMeasurement;
import com.barthel.regcalc.domain.model.liability.MeasurementModel;
import com.barthel.regcalc.domain.model.liability.RaMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Variable fee approach. Groups failing any direct-participation criterion
 * are measured under the general model instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VariableFeeMeasurementService implements MeasureLiabilityUseCase {

    private final GeneralModelMeasurementService generalModel;

    @Override
    public LiabilityMeasurement measure(CashFlowSchedule schedule, BigDecimal acquisitionCosts, RaMethod raMethod,
                                        MeasurementModel model, MacroContext macroContext) {
        GeneralModelMeasurementService.requireInputs(schedule, acquisitionCosts, raMethod, macroContext);
        MeasurementModel applied = MeasurementModel.VFA;
        if (!schedule.features().allHold()) {
            log.warn("Group {} is not eligible for VFA ({}); measuring under GMM", schedule.groupId(),
                    schedule.features());
            applied = MeasurementModel.GMM;
        }
        return generalModel.measureWithMargin(schedule, acquisitionCosts, raMethod, macroContext,
                MeasurementModel.VFA, applied);
    }

    @Override
    public boolean supports(MeasurementModel model) {
        return model == MeasurementModel.VFA;
    }
}
