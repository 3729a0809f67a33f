package com.barthel.regcalc.application.service.solvency;

import com.barthel.regcalc.config.SolvencyProperties;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.model.solvency.IfrsAdjustments;
import com.barthel.regcalc.domain.model.solvency.OwnFunds;
import com.barthel.regcalc.domain.model.solvency.OwnFundsInput;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Eligible own funds. Subordinated debt above the cap is excluded, not rejected.
 */
@Component
@RequiredArgsConstructor
public class OwnFundsCalculator {

    private final SolvencyProperties properties;
    private final Rounding rounding;

    public OwnFunds calculate(OwnFundsInput input, IfrsAdjustments adjustments) {
        BigDecimal base = input.equity()
                .subtract(adjustments.ecl())
                .subtract(input.illiquidAssets())
                .subtract(input.intangibleAssets())
                .add(adjustments.csm());
        BigDecimal cap = rounding.money(base.multiply(properties.getSubordinatedDebtCap()).max(BigDecimal.ZERO));
        BigDecimal included = input.subordinatedDebt().min(cap);
        BigDecimal excess = input.subordinatedDebt().subtract(included);
        BigDecimal amount = base.add(included).subtract(input.repoPenalty());
        return new OwnFunds(rounding.money(base), cap, rounding.money(included), rounding.money(excess),
                rounding.money(input.repoPenalty()), rounding.money(amount));
    }
}
