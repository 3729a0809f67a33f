package com.barthel.regcalc.application.service.unified;

import com.barthel.regcalc.EngineFixtures;
import com.barthel.regcalc.application.port.in.AssessSolvencyUseCase;
import com.barthel.regcalc.application.port.in.MeasureLiabilityUseCase;
import com.barthel.regcalc.domain.exception.CalculationException;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.common.Scenario;
import com.barthel.regcalc.domain.model.credit.Exposure;
import com.barthel.regcalc.domain.model.credit.RepoPosition;
import com.barthel.regcalc.domain.model.liability.CashFlow;
import com.barthel.regcalc.domain.model.liability.CashFlowSchedule;
import com.barthel.regcalc.domain.model.liability.ContractGroupRequest;
import com.barthel.regcalc.domain.model.liability.LiabilityMeasurement;
import com.barthel.regcalc.domain.model.liability.MeasurementModel;
import com.barthel.regcalc.domain.model.liability.RaMethod;
import com.barthel.regcalc.domain.model.solvency.MinimumMarginInput;
import com.barthel.regcalc.domain.model.solvency.OwnFundsInput;
import com.barthel.regcalc.domain.model.unified.UnifiedCalculationRequest;
import com.barthel.regcalc.domain.model.unified.UnifiedCalculationResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class UnifiedCalculationServiceTest {

    private final EngineFixtures fixtures = new EngineFixtures();

    private static Exposure loan(String id) {
        return Exposure.builder()
                .id(id)
                .grossCarryingAmount(new BigDecimal("50000000"))
                .annualPd(new BigDecimal("0.03"))
                .pdAtOrigination(new BigDecimal("0.02"))
                .lgd(new BigDecimal("0.45"))
                .effectiveInterestRate(new BigDecimal("0.12"))
                .remainingTerm(3)
                .build();
    }

    private static ContractGroupRequest group(String groupId, MeasurementModel model) {
        List<CashFlow> flows = new ArrayList<>();
        for (int t = 1; t <= 3; t++) {
            flows.add(new CashFlow(t, new BigDecimal("40000000"), new BigDecimal("20000000"),
                    new BigDecimal("2000000"), null));
        }
        CashFlowSchedule schedule = CashFlowSchedule.builder().groupId(groupId).periods(flows).build();
        return new ContractGroupRequest(schedule, new BigDecimal("1000000"), RaMethod.VAR, model);
    }

    private static UnifiedCalculationRequest.UnifiedCalculationRequestBuilder request() {
        return UnifiedCalculationRequest.builder()
                .valuationDate(EngineFixtures.VALUATION_DATE)
                .scenario(Scenario.BASE)
                .exposures(List.of(loan("L-1"), loan("L-2")))
                .contractGroups(List.of(group("G-1", MeasurementModel.GMM), group("G-2", MeasurementModel.PAA)))
                .minimumMargin(MinimumMarginInput.builder()
                        .grossPremiums(new BigDecimal("35000000000"))
                        .incurredClaims(new BigDecimal("18000000000"))
                        .build())
                .ownFunds(OwnFundsInput.builder().equity(new BigDecimal("20000000000")).build());
    }

    @Test
    void creditAndLiabilityResultsFeedOwnFunds() {
        UnifiedCalculationResult result = fixtures.unifiedService.run(request().build());

        assertThat(result.macroContext().valuationDate()).isEqualTo(EngineFixtures.VALUATION_DATE);
        assertThat(result.credit().results()).hasSize(2);
        assertThat(result.liabilities()).extracting(LiabilityMeasurement::groupId).containsExactly("G-1", "G-2");
        BigDecimal csm = result.liabilities().stream()
                .map(m -> m.csm().csm())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(result.totalCsm()).isEqualByComparingTo(csm);
        assertThat(result.adjustments().ecl()).isEqualByComparingTo(result.credit().totalEcl());
        assertThat(result.adjustments().csm()).isEqualByComparingTo(result.totalCsm());
        assertThat(result.solvency().ownFunds().base()).isEqualByComparingTo(new BigDecimal("20000000000")
                .subtract(result.credit().totalEcl())
                .add(result.totalCsm()));
        assertThat(result.repoCheck()).isNull();
        assertThat(result.solvency().ownFunds().repoPenalty()).isZero();
    }

    @Test
    void repoBreachBecomesOwnFundsPenalty() {
        UnifiedCalculationResult result = fixtures.unifiedService.run(request()
                .repoPosition(new RepoPosition(new BigDecimal("500000000"), new BigDecimal("1000000000")))
                .build());

        assertThat(result.repoCheck().compliant()).isFalse();
        assertThat(result.repoCheck().limit()).isEqualByComparingTo("0.35");
        // 0.15 excess * 1bn reserves * 5%
        assertThat(result.repoCheck().penalty()).isEqualByComparingTo("7500000");
        assertThat(result.solvency().ownFunds().repoPenalty()).isEqualByComparingTo(result.repoCheck().penalty());
        assertThat(result.solvency().ownFunds().amount())
                .isEqualByComparingTo(result.solvency().ownFunds().base().subtract(new BigDecimal("7500000")));
    }

    @Test
    void emptyPortfolioRunsSolvencyAlone() {
        UnifiedCalculationResult result = fixtures.unifiedService.run(request()
                .exposures(List.of())
                .contractGroups(List.of())
                .build());

        assertThat(result.credit().totalEcl()).isZero();
        assertThat(result.totalCsm()).isZero();
        assertThat(result.solvency().ratio()).isEqualByComparingTo("5.0390526581");
    }

    @Test
    void liabilityFailureAbortsTheRun() {
        MeasureLiabilityUseCase failing = mock(MeasureLiabilityUseCase.class);
        when(failing.measure(any(), any(), any(), any(), any()))
                .thenThrow(new CalculationException("cash flows diverged"));
        AssessSolvencyUseCase solvency = mock(AssessSolvencyUseCase.class);
        UnifiedCalculationService service = new UnifiedCalculationService(fixtures.macroAdapter,
                fixtures.portfolioService, failing, solvency, fixtures.repoLimitService, fixtures.rounding);

        assertThatThrownBy(() -> service.run(request().build()))
                .isInstanceOf(CalculationException.class)
                .hasMessageContaining("diverged");
        verifyNoInteractions(solvency);
    }

    @Test
    void requestNeedsSolvencyBases() {
        assertThatThrownBy(() -> fixtures.unifiedService.run(null)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> request().ownFunds(null).build()).isInstanceOf(InvalidInputException.class);
    }
}
