package com.barthel.regcalc.domain.model.solvency;

import com.barthel.regcalc.domain.exception.InvalidInputException;

import java.math.BigDecimal;
import java.util.stream.Stream;

/**
 * Inputs of the standard-formula capital requirement.
 */
public record ScrInput(
        MarketRiskExposure market,
        UnderwritingRisk underwriting,
        BigDecimal grossPremiums,
        BigDecimal technicalProvisions) {

    public ScrInput {
        if (market == null || underwriting == null || grossPremiums == null || technicalProvisions == null) {
            throw new InvalidInputException("All SCR inputs are required");
        }
        boolean negative = Stream.of(market.equity(), market.property(), market.interestRateSensitivity(),
                        market.spread(), underwriting.premiumRisk(), underwriting.reserveRisk(),
                        underwriting.catastropheRisk(), grossPremiums, technicalProvisions)
                .anyMatch(v -> v == null || v.signum() < 0);
        if (negative) {
            throw new InvalidInputException("SCR exposures and risk charges must be non-negative");
        }
    }
}
