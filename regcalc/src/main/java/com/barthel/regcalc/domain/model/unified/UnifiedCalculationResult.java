package com.barthel.regcalc.domain.model.unified;

import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.credit.PortfolioEclSummary;
import com.barthel.regcalc.domain.model.credit.RepoLimitCheck;
import com.barthel.regcalc.domain.model.liability.LiabilityMeasurement;
import com.barthel.regcalc.domain.model.solvency.IfrsAdjustments;
import com.barthel.regcalc.domain.model.solvency.SolvencyPosition;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param macroContext context the run used
 * @param credit portfolio ECL
 * @param liabilities measurement per contract group, in request order
 * @param totalCsm CSM summed over the groups
 * @param totalRiskAdjustment RA summed over the groups
 * @param repoCheck repo limit outcome, {@code null} when no position was given
 * @param adjustments own-funds adjustments passed to the solvency engine
 * @param solvency solvency position
 */
public record UnifiedCalculationResult(
        MacroContext macroContext,
        PortfolioEclSummary credit,
        List<LiabilityMeasurement> liabilities,
        BigDecimal totalCsm,
        BigDecimal totalRiskAdjustment,
        RepoLimitCheck repoCheck,
        IfrsAdjustments adjustments,
        SolvencyPosition solvency) {

    public UnifiedCalculationResult {
        liabilities = List.copyOf(liabilities);
    }
}
