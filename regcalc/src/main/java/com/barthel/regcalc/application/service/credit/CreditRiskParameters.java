package com.barthel.regcalc.application.service.credit;

import com.barthel.regcalc.config.CreditRiskProperties;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.common.Scenario;
import com.barthel.regcalc.domain.model.credit.Exposure;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * PD, LGD and EAD estimators feeding the ECL aggregation.
 */
@Component
@RequiredArgsConstructor
public class CreditRiskParameters {

    private static final BigDecimal DEFAULT_CCF = new BigDecimal("0.50");

    private final CreditRiskProperties properties;
    private final Rounding rounding;

    /**
     * {@code GCA + undrawn * CCF(facility)}.
     */
    public BigDecimal exposureAtDefault(Exposure exposure) {
        BigDecimal ccf = properties.getCcfByFacility().getOrDefault(exposure.facilityType(), DEFAULT_CCF);
        return exposure.grossCarryingAmount().add(exposure.undrawnAmount().multiply(ccf));
    }

    /**
     * Historical PD times the scenario multiplier, capped at 1.
     */
    public BigDecimal adjustedPd(Exposure exposure, MacroContext macroContext, Scenario scenario) {
        BigDecimal adjusted = exposure.annualPd().multiply(macroContext.multiplier(scenario));
        return rounding.ratio(adjusted.min(BigDecimal.ONE));
    }

    /**
     * Collateral-type LGD (unless supplied), scaled by the uncovered share of
     * EAD and by the macro factor, clamped to [0, 1].
     */
    public BigDecimal adjustedLgd(Exposure exposure, BigDecimal exposureAtDefault, MacroContext macroContext) {
        BigDecimal lgd = exposure.lgd() != null
                ? exposure.lgd()
                : properties.getLgdByCollateral().get(exposure.collateral().type());

        BigDecimal collateralValue = exposure.collateral().value();
        if (collateralValue.signum() > 0 && exposureAtDefault.signum() > 0) {
            BigDecimal uncovered = rounding.divide(exposureAtDefault.subtract(collateralValue), exposureAtDefault);
            lgd = lgd.multiply(clampUnit(uncovered));
        }
        return rounding.ratio(clampUnit(lgd.multiply(macroFactor(macroContext))));
    }

    public BigDecimal macroFactor(MacroContext macroContext) {
        CreditRiskProperties.MacroLgd macro = properties.getMacroLgd();
        BigDecimal inflationGap = macroContext.inflation().subtract(macro.getReferenceInflation());
        BigDecimal rateGap = macroContext.baseRate().subtract(macro.getReferenceRate());
        return BigDecimal.ONE
                .add(macro.getInflationSensitivity().multiply(inflationGap))
                .add(macro.getRateSensitivity().multiply(rateGap));
    }

    static BigDecimal clampUnit(BigDecimal value) {
        return value.max(BigDecimal.ZERO).min(BigDecimal.ONE);
    }
}
