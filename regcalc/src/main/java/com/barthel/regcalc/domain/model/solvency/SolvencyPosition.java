package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;

/**
 * Capital adequacy of the insurer for one calculation run.
 *
 * @param minimumMargin required minimum margin
 * @param ownFunds eligible own funds
 * @param ratio {@code FMP / MMP}, zero when MMP is zero
 * @param compliant {@code ratio >= 1}
 * @param band qualitative band of the ratio
 * @param stressTest deterministic and simulated stress
 * @param auditDigest digest of inputs and result, identical for identical inputs
 */
public record SolvencyPosition(
        MinimumMargin minimumMargin,
        OwnFunds ownFunds,
        BigDecimal ratio,
        boolean compliant,
        SolvencyBand band,
        StressTestResult stressTest,
        String auditDigest) {
}
