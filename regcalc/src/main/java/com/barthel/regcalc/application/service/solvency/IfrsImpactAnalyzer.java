package com.barthel.regcalc.application.service.solvency;

import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.model.solvency.IfrsImpact;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Solvency ratio before and after the IFRS 9 and IFRS 17 effects.
 */
@Service
@RequiredArgsConstructor
public class IfrsImpactAnalyzer {

    private static final BigDecimal PERCENTAGE_POINTS = BigDecimal.valueOf(100);

    private final SolvencyStressTester stressTester;
    private final Rounding rounding;

    /**
     * @param ownFunds own funds before the IFRS effects
     * @param minimumMargin minimum margin before the IFRS effects
     * @param eclImpact ECL deducted from own funds
     * @param csmImpact CSM added to own funds
     * @param belRaImpact BEL and RA effect released from the margin
     */
    public IfrsImpact analyze(BigDecimal ownFunds, BigDecimal minimumMargin, BigDecimal eclImpact,
                              BigDecimal csmImpact, BigDecimal belRaImpact) {
        BigDecimal preRatio = stressTester.ratio(ownFunds, minimumMargin);
        BigDecimal postFunds = rounding.money(ownFunds.subtract(eclImpact).add(csmImpact));
        BigDecimal postMargin = rounding.money(minimumMargin.subtract(belRaImpact));
        BigDecimal postRatio = stressTester.ratio(postFunds, postMargin);
        return new IfrsImpact(rounding.money(ownFunds), rounding.money(minimumMargin), preRatio, postFunds,
                postMargin, postRatio, postRatio.subtract(preRatio).multiply(PERCENTAGE_POINTS));
    }
}
