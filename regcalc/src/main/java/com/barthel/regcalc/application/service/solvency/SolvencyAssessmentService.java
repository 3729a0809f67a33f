package com.barthel.regcalc.application.service.solvency;

import com.barthel.regcalc.application.port.in.AssessSolvencyUseCase;
import com.barthel.regcalc.application.service.audit.AuditTrailRecorder;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.audit.AuditRecord;
import com.barthel.regcalc.domain.model.audit.RegulatoryReference;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.solvency.IfrsAdjustments;
import com.barthel.regcalc.domain.model.solvency.MinimumMargin;
import com.barthel.regcalc.domain.model.solvency.MinimumMarginInput;
import com.barthel.regcalc.domain.model.solvency.OwnFunds;
import com.barthel.regcalc.domain.model.solvency.OwnFundsInput;
import com.barthel.regcalc.domain.model.solvency.SolvencyBand;
import com.barthel.regcalc.domain.model.solvency.SolvencyPosition;
import com.barthel.regcalc.domain.model.solvency.StressTestResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Capital adequacy from the minimum margin and eligible own funds.
 * A pure function of its inputs: equal inputs give equal positions,
 * audit digest included.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SolvencyAssessmentService implements AssessSolvencyUseCase {

    private final MinimumMarginCalculator minimumMarginCalculator;
    private final OwnFundsCalculator ownFundsCalculator;
    private final SolvencyStressTester stressTester;
    private final AuditTrailRecorder auditTrailRecorder;

    @Override
    public SolvencyPosition assess(MinimumMarginInput margin, OwnFundsInput ownFunds, IfrsAdjustments adjustments,
                                   MacroContext macroContext) {
        if (margin == null || ownFunds == null || macroContext == null) {
            throw new InvalidInputException("Margin bases, own funds and macro context are required");
        }
        IfrsAdjustments applied = adjustments == null ? IfrsAdjustments.NONE : adjustments;

        MinimumMargin minimumMargin = minimumMarginCalculator.calculate(margin);
        OwnFunds funds = ownFundsCalculator.calculate(ownFunds, applied);
        BigDecimal ratio = stressTester.ratio(funds.amount(), minimumMargin.amount());
        boolean compliant = SolvencyStressTester.compliant(minimumMargin.amount(), ratio);
        StressTestResult stress = stressTester.stress(funds.amount(), minimumMargin.amount());

        SolvencyPosition unsigned = new SolvencyPosition(minimumMargin, funds, ratio, compliant,
                SolvencyBand.of(ratio), stress, null);
        AuditRecord auditRecord = auditTrailRecorder.record("Solvency assessment",
                List.of(margin, ownFunds, applied, macroContext), unsigned, RegulatoryReference.SOLVENCY_MARGIN);
        String auditDigest = AuditTrailRecorder.digest(auditRecord.inputDigest() + auditRecord.resultDigest());

        log.info("Solvency on {} mmp={} fmp={} ratio={} compliant={}", macroContext.valuationDate(),
                minimumMargin.amount(), funds.amount(), ratio, compliant);
        return new SolvencyPosition(minimumMargin, funds, ratio, compliant, unsigned.band(), stress, auditDigest);
    }
}
