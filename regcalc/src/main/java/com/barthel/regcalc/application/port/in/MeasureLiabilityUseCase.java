package com.barthel.regcalc.application.port.in;

import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.liability.CashFlowSchedule;
import com.barthel.regcalc.domain.model.liability.LiabilityMeasurement;
import com.barthel.regcalc.domain.model.liability.MeasurementModel;
import com.barthel.regcalc.domain.model.liability.RaMethod;

import java.math.BigDecimal;

/**
 * Use case for measuring the insurance liability of a contract group.
 */
public interface MeasureLiabilityUseCase {
    /**
     * Measures BEL, RA and CSM (or the PAA liability) of the group.
     *
     * @param schedule the projected cash flows
     * @param acquisitionCosts acquisition costs at initial recognition
     * @param raMethod the risk-adjustment technique
     * @param model the requested measurement model
     * @param macroContext the macroeconomic snapshot
     * @return the resulting {@link LiabilityMeasurement}
     */
    LiabilityMeasurement measure(CashFlowSchedule schedule, BigDecimal acquisitionCosts, RaMethod raMethod,
                                 MeasurementModel model, MacroContext macroContext);

    /**
     * Whether this implementation handles the given measurement model.
     *
     * @param model the model to check
     * @return true if supported
     */
    boolean supports(MeasurementModel model);
}
