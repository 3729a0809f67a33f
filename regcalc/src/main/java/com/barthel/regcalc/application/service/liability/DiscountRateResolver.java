package com.barthel.regcalc.application.service.liability;

import com.barthel.regcalc.application.port.out.FetchRiskFreeRatePort;
import com.barthel.regcalc.config.LiabilityProperties;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.model.common.MacroContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Bottom-up discount rate: risk-free rate plus a term-scaled illiquidity premium.
 */
@Component
@RequiredArgsConstructor
public class DiscountRateResolver {

    private final FetchRiskFreeRatePort fetchRiskFreeRatePort;
    private final LiabilityProperties properties;
    private final Rounding rounding;

    public BigDecimal resolve(MacroContext macroContext, int term) {
        BigDecimal riskFree = fetchRiskFreeRatePort.fetchRiskFreeRate(macroContext, term);
        LiabilityProperties.Discount discount = properties.getDiscount();
        BigDecimal premium = discount.getIlliquidityPremium().multiply(termFactor(term));
        return rounding.ratio(riskFree.add(premium));
    }

    BigDecimal termFactor(int term) {
        LiabilityProperties.Discount discount = properties.getDiscount();
        if (term <= 3) {
            return discount.getShortTermFactor();
        }
        return term == 4 ? discount.getMediumTermFactor() : discount.getLongTermFactor();
    }
}
