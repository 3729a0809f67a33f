package com.barthel.regcalc.domain.model.liability;

import java.math.BigDecimal;

/**
 * Result of one CSM roll-forward step.
 *
 * @param model GMM or VFA
 * @param opening opening CSM
 * @param newBusiness CSM of new contracts
 * @param interestAccretion {@code opening * rate}; zero under VFA
 * @param futureServiceAdjustment changes for future service (GMM) or fair-value plus non-variable changes (VFA)
 * @param currencyEffect FX effect
 * @param release amount released for services provided in the period
 * @param closing closing CSM, floored at zero
 * @param floored true when the unfloored balance was negative
 */
public record CsmMovement(
        MeasurementModel model,
        BigDecimal opening,
        BigDecimal newBusiness,
        BigDecimal interestAccretion,
        BigDecimal futureServiceAdjustment,
        BigDecimal currencyEffect,
        BigDecimal release,
        BigDecimal closing,
        boolean floored) {
}
