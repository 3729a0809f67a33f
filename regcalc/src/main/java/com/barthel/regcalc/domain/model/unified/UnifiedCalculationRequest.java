package com.barthel.regcalc.domain.model.unified;

import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.common.Scenario;
import com.barthel.regcalc.domain.model.credit.Exposure;
import com.barthel.regcalc.domain.model.credit.RepoPosition;
import com.barthel.regcalc.domain.model.liability.ContractGroupRequest;
import com.barthel.regcalc.domain.model.solvency.MinimumMarginInput;
import com.barthel.regcalc.domain.model.solvency.OwnFundsInput;
import lombok.Builder;

import java.time.LocalDate;
import java.util.List;

/**
 * One end-to-end run: credit portfolio, contract groups and solvency bases.
 *
 * @param valuationDate date the macro context is resolved for
 * @param scenario credit scenario
 * @param exposures credit portfolio
 * @param contractGroups insurance contract groups
 * @param minimumMargin minimum margin bases
 * @param ownFunds own-funds items; any repo penalty is derived from {@code repoPosition}
 * @param repoPosition optional repo exposure, {@code null} when not checked
 */
@Builder
public record UnifiedCalculationRequest(
        LocalDate valuationDate,
        Scenario scenario,
        List<Exposure> exposures,
        List<ContractGroupRequest> contractGroups,
        MinimumMarginInput minimumMargin,
        OwnFundsInput ownFunds,
        RepoPosition repoPosition) {

    public UnifiedCalculationRequest {
        if (valuationDate == null || minimumMargin == null || ownFunds == null) {
            throw new InvalidInputException("Valuation date, minimum margin and own funds inputs are required");
        }
        scenario = scenario == null ? Scenario.WEIGHTED : scenario;
        exposures = exposures == null ? List.of() : List.copyOf(exposures);
        contractGroups = contractGroups == null ? List.of() : List.copyOf(contractGroups);
    }
}
