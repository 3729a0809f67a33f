package com.barthel.regcalc.domain.model.liability;

import java.math.BigDecimal;

/**
 * Measured insurance liability of one contract group.
 *
 * @param groupId contract group identifier
 * @param requestedModel model the caller asked for
 * @param model model actually applied; VFA falls back to GMM when not eligible
 * @param bel best estimate liability
 * @param riskAdjustment risk adjustment
 * @param csm CSM or loss component at initial recognition; zero for PAA
 * @param premiumAllocation PAA details, {@code null} for GMM and VFA
 * @param fulfilmentCashFlows {@code BEL + RA}
 * @param totalLiability {@code FCF + CSM} or {@code FCF + loss component}; the LRC under PAA
 */
public record LiabilityMeasurement(
        String groupId,
        MeasurementModel requestedModel,
        MeasurementModel model,
        BelResult bel,
        RaResult riskAdjustment,
        CsmResult csm,
        PaaResult premiumAllocation,
        BigDecimal fulfilmentCashFlows,
        BigDecimal totalLiability) {
}
