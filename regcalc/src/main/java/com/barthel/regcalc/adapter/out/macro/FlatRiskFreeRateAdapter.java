package com.barthel.regcalc.adapter.out.macro;

import com.barthel.regcalc.application.port.out.FetchRiskFreeRatePort;
import com.barthel.regcalc.domain.model.common.MacroContext;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Flat curve at the central bank base rate.
 */
@Component
public class FlatRiskFreeRateAdapter implements FetchRiskFreeRatePort {

    @Override
    public BigDecimal fetchRiskFreeRate(MacroContext macroContext, int tenor) {
        return macroContext.baseRate();
    }
}
