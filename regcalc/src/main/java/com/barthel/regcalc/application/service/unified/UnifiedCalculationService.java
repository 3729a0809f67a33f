package com.barthel.regcalc.application.service.unified;

import com.barthel.regcalc.application.port.in.AggregatePortfolioEclUseCase;
import com.barthel.regcalc.application.port.in.AssessSolvencyUseCase;
import com.barthel.regcalc.application.port.in.MeasureLiabilityUseCase;
import com.barthel.regcalc.application.port.in.RunUnifiedCalculationUseCase;
import com.barthel.regcalc.application.port.out.FetchMacroContextPort;
import com.barthel.regcalc.application.service.credit.RepoLimitService;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.credit.PortfolioEclSummary;
import com.barthel.regcalc.domain.model.credit.RepoLimitCheck;
import com.barthel.regcalc.domain.model.liability.ContractGroupRequest;
import com.barthel.regcalc.domain.model.liability.LiabilityMeasurement;
import com.barthel.regcalc.domain.model.solvency.IfrsAdjustments;
import com.barthel.regcalc.domain.model.solvency.OwnFundsInput;
import com.barthel.regcalc.domain.model.solvency.SolvencyPosition;
import com.barthel.regcalc.domain.model.unified.UnifiedCalculationRequest;
import com.barthel.regcalc.domain.model.unified.UnifiedCalculationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Runs credit, liability and solvency in that order against one macro context.
 * Portfolio ECL reduces own funds, group CSM is added back and a repo breach
 * becomes an own-funds penalty.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UnifiedCalculationService implements RunUnifiedCalculationUseCase {

    private final FetchMacroContextPort fetchMacroContextPort;
    private final AggregatePortfolioEclUseCase aggregatePortfolioEclUseCase;
    private final MeasureLiabilityUseCase measureLiabilityUseCase;
    private final AssessSolvencyUseCase assessSolvencyUseCase;
    private final RepoLimitService repoLimitService;
    private final Rounding rounding;

    @Override
    public UnifiedCalculationResult run(UnifiedCalculationRequest request) {
        if (request == null) {
            throw new InvalidInputException("Calculation request is required");
        }
        MacroContext macroContext = fetchMacroContextPort.fetchMacroContext(request.valuationDate());
        log.info("Unified run on {} scenario={} exposures={} groups={}", macroContext.valuationDate(),
                request.scenario(), request.exposures().size(), request.contractGroups().size());

        PortfolioEclSummary credit = aggregatePortfolioEclUseCase.aggregate(request.exposures(), macroContext,
                request.scenario());
        if (credit.hasFailures()) {
            log.warn("{} exposure(s) excluded from the portfolio ECL", credit.failures().size());
        }

        List<LiabilityMeasurement> liabilities = request.contractGroups().stream()
                .map(group -> measure(group, macroContext))
                .toList();
        BigDecimal totalCsm = liabilities.stream()
                .map(measurement -> measurement.csm().csm())
                .reduce(rounding.zeroMoney(), BigDecimal::add);
        BigDecimal totalRiskAdjustment = liabilities.stream()
                .map(measurement -> measurement.riskAdjustment().riskAdjustment())
                .reduce(rounding.zeroMoney(), BigDecimal::add);

        RepoLimitCheck repoCheck = null;
        OwnFundsInput ownFunds = request.ownFunds();
        if (request.repoPosition() != null) {
            repoCheck = repoLimitService.check(request.repoPosition(), macroContext.valuationDate());
            ownFunds = ownFunds.withRepoPenalty(ownFunds.repoPenalty().add(repoCheck.penalty()));
        }

        IfrsAdjustments adjustments = new IfrsAdjustments(credit.totalEcl(), totalCsm);
        SolvencyPosition solvency = assessSolvencyUseCase.assess(request.minimumMargin(), ownFunds, adjustments,
                macroContext);

        return new UnifiedCalculationResult(macroContext, credit, liabilities, totalCsm, totalRiskAdjustment,
                repoCheck, adjustments, solvency);
    }

    private LiabilityMeasurement measure(ContractGroupRequest group, MacroContext macroContext) {
        return measureLiabilityUseCase.measure(group.schedule(), group.acquisitionCosts(), group.raMethod(),
                group.model(), macroContext);
    }
}
