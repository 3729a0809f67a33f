package com.barthel.regcalc.application.service.solvency;

import com.barthel.regcalc.config.SolvencyProperties;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.solvency.MinimumMargin;
import com.barthel.regcalc.domain.model.solvency.MinimumMarginInput;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Required minimum margin: the larger of the tiered premium and claims
 * margins, plus life addon and compulsory loading, floored at the
 * guaranteed fund of the licence class.
 */
@Component
@RequiredArgsConstructor
public class MinimumMarginCalculator {

    private final SolvencyProperties properties;
    private final Rounding rounding;

    public MinimumMargin calculate(MinimumMarginInput input) {
        BigDecimal k = correctionCoefficient(input);
        BigDecimal byPremiums = rounding.money(tiered(input.grossPremiums(), properties.getPremiumTier()).multiply(k));
        BigDecimal byClaims = rounding.money(tiered(input.incurredClaims(), properties.getClaimsTier()).multiply(k));
        BigDecimal base = byPremiums.max(byClaims);

        BigDecimal lifeAddon = rounding.money(input.annuityReserves().multiply(properties.getAnnuityAddonRate())
                .add(input.mathematicalReserves().multiply(properties.getMathematicalReserveAddonRate())));
        BigDecimal loading = input.compulsoryLines()
                ? rounding.money(base.multiply(properties.getCompulsoryLoading()))
                : rounding.zeroMoney();

        BigDecimal guaranteedFund = rounding.money(properties.getGuaranteedFund().get(input.insurerClass()));
        BigDecimal total = base.add(lifeAddon).add(loading);
        boolean floorApplied = total.compareTo(guaranteedFund) < 0;
        return new MinimumMargin(byPremiums, byClaims, base, lifeAddon, loading, guaranteedFund,
                floorApplied ? guaranteedFund : total, floorApplied);
    }

    /**
     * {@code max(0, rate1 * min(base, threshold) + rate2 * max(0, base - threshold))}.
     */
    static BigDecimal tiered(BigDecimal base, SolvencyProperties.Tier tier) {
        BigDecimal first = base.min(tier.getThreshold()).multiply(tier.getFirstRate());
        BigDecimal second = base.subtract(tier.getThreshold()).max(BigDecimal.ZERO).multiply(tier.getSecondRate());
        return first.add(second).max(BigDecimal.ZERO);
    }

    private BigDecimal correctionCoefficient(MinimumMarginInput input) {
        SolvencyProperties.Correction correction = properties.getCorrection();
        BigDecimal k = input.correctionCoefficient() != null
                ? input.correctionCoefficient()
                : correction.getDefaultCoefficient();
        if (k.compareTo(correction.getMinimum()) < 0 || k.compareTo(correction.getMaximum()) > 0) {
            throw new InvalidInputException("Correction coefficient " + k + " outside ["
                    + correction.getMinimum() + ", " + correction.getMaximum() + "]");
        }
        return k;
    }
}
