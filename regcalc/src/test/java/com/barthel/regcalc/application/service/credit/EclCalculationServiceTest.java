package com.barthel.regcalc.application.service.credit;

import com.barthel.regcalc.EngineFixtures;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.audit.AuditRecord;
import com.barthel.regcalc.domain.model.audit.RegulatoryReference;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.common.Scenario;
import com.barthel.regcalc.domain.model.credit.Collateral;
import com.barthel.regcalc.domain.model.credit.CollateralType;
import com.barthel.regcalc.domain.model.credit.CreditEvent;
import com.barthel.regcalc.domain.model.credit.EclResult;
import com.barthel.regcalc.domain.model.credit.Exposure;
import com.barthel.regcalc.domain.model.credit.ImpairmentStage;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EclCalculationServiceTest {

    private final EngineFixtures fixtures = new EngineFixtures();
    private final EclCalculationService service = fixtures.eclService;
    private final MacroContext macro = fixtures.macroContext();

    private static Exposure.ExposureBuilder corporateLoan() {
        return Exposure.builder()
                .id("CORP-001")
                .grossCarryingAmount(new BigDecimal("500000000"))
                .annualPd(new BigDecimal("0.095"))
                .pdAtOrigination(new BigDecimal("0.03"))
                .lgd(new BigDecimal("0.69"))
                .effectiveInterestRate(new BigDecimal("0.19"))
                .remainingTerm(3)
                .daysPastDue(0);
    }

    @Test
    void deterioratedLoanIsStagedTwoWithLifetimeLoss() {
        EclResult result = service.classifyAndQuantify(corporateLoan().build(), macro, Scenario.WEIGHTED);

        assertThat(result.stage()).isEqualTo(ImpairmentStage.STAGE_2);
        assertThat(result.horizon()).isEqualTo(3);
        assertThat(result.periods()).hasSize(3);
        assertThat(result.adjustedPd()).isEqualByComparingTo("0.1531875");
        assertThat(result.ecl()).isPositive();
        assertThat(result.ecl()).isLessThan(new BigDecimal("500000000"));
        assertThat(result.ecl().scale()).isEqualTo(3);
    }

    @Test
    void weightedScenarioUsesBlendedMultiplier() {
        assertThat(macro.multiplier(Scenario.WEIGHTED)).isEqualByComparingTo("1.6125");
    }

    @Test
    void stageOneUsesTwelveMonthHorizon() {
        Exposure exposure = corporateLoan()
                .annualPd(new BigDecimal("0.010"))
                .pdAtOrigination(new BigDecimal("0.010"))
                .remainingTerm(10)
                .build();

        EclResult result = service.classifyAndQuantify(exposure, macro, Scenario.BASE);

        assertThat(result.stage()).isEqualTo(ImpairmentStage.STAGE_1);
        assertThat(result.horizon()).isEqualTo(1);
        assertThat(result.pdVector()).hasSize(1);
    }

    @Test
    void worseStageNeverLowersTheLoss() {
        Exposure exposure = corporateLoan().remainingTerm(5).daysPastDue(60).build();

        EclResult stageOne = service.quantify(exposure, ImpairmentStage.STAGE_1, macro, Scenario.BASE);
        EclResult stageTwo = service.quantify(exposure, ImpairmentStage.STAGE_2, macro, Scenario.BASE);
        EclResult stageThree = service.quantify(exposure, ImpairmentStage.STAGE_3, macro, Scenario.BASE);

        assertThat(stageOne.horizon()).isEqualTo(1);
        assertThat(stageTwo.horizon()).isEqualTo(5);
        assertThat(stageTwo.ecl()).isGreaterThan(stageOne.ecl());
        assertThat(stageThree.stageThreeUplift()).isGreaterThan(BigDecimal.ONE);
        assertThat(stageThree.ecl()).isGreaterThanOrEqualTo(stageTwo.ecl());
    }

    @Test
    void singlePeriodLoanLosesTheSameInStageOneAndTwo() {
        Exposure exposure = corporateLoan().remainingTerm(1).build();

        EclResult stageOne = service.quantify(exposure, ImpairmentStage.STAGE_1, macro, Scenario.WEIGHTED);
        EclResult stageTwo = service.quantify(exposure, ImpairmentStage.STAGE_2, macro, Scenario.WEIGHTED);

        assertThat(stageTwo.ecl()).isEqualByComparingTo(stageOne.ecl());
    }

    @Test
    void higherPdNeverLowersTheLoss() {
        BigDecimal previous = BigDecimal.ZERO;
        for (String pd : new String[]{"0.01", "0.05", "0.10", "0.20", "0.40"}) {
            Exposure exposure = corporateLoan().annualPd(new BigDecimal(pd)).build();
            EclResult result = service.quantify(exposure, ImpairmentStage.STAGE_2, macro, Scenario.BASE);
            assertThat(result.ecl()).isGreaterThanOrEqualTo(previous);
            previous = result.ecl();
        }
    }

    @Test
    void lossNeverExceedsExposureEvenAtCertainDefault() {
        Exposure exposure = corporateLoan()
                .annualPd(BigDecimal.ONE)
                .lgd(BigDecimal.ONE)
                .effectiveInterestRate(BigDecimal.ZERO)
                .daysPastDue(120)
                .build();

        EclResult result = service.classifyAndQuantify(exposure, macro, Scenario.SEVERE);

        assertThat(result.stage()).isEqualTo(ImpairmentStage.STAGE_3);
        assertThat(result.stageThreeUplift()).isEqualByComparingTo("1.2");
        assertThat(result.ecl()).isGreaterThan(BigDecimal.ZERO);
        assertThat(result.ecl()).isLessThanOrEqualTo(
                result.eadVector().stream().reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    @Test
    void stageThreeUpliftScalesWithDelinquency() {
        Exposure defaulted = corporateLoan()
                .creditEvents(Set.of(CreditEvent.DEFAULT_EVENT))
                .daysPastDue(45)
                .build();

        EclResult result = service.classifyAndQuantify(defaulted, macro, Scenario.BASE);

        assertThat(result.stage()).isEqualTo(ImpairmentStage.STAGE_3);
        assertThat(result.stageThreeUplift()).isEqualByComparingTo("1.1");
    }

    @Test
    void collateralReducesLoss() {
        Exposure unsecured = corporateLoan().lgd(null).build();
        Exposure secured = corporateLoan()
                .lgd(null)
                .collateral(new Collateral(CollateralType.REAL_ESTATE, new BigDecimal("250000000")))
                .build();

        EclResult unsecuredResult = service.quantify(unsecured, ImpairmentStage.STAGE_2, macro, Scenario.BASE);
        EclResult securedResult = service.quantify(secured, ImpairmentStage.STAGE_2, macro, Scenario.BASE);

        assertThat(securedResult.lgd()).isLessThan(unsecuredResult.lgd());
        assertThat(securedResult.ecl()).isLessThan(unsecuredResult.ecl());
    }

    @Test
    void eachCalculationIsAudited() {
        service.classifyAndQuantify(corporateLoan().build(), macro, Scenario.WEIGHTED);
        service.classifyAndQuantify(corporateLoan().build(), macro, Scenario.WEIGHTED);

        assertThat(fixtures.auditTrail.records()).hasSize(2);
        AuditRecord first = fixtures.auditTrail.records().get(0);
        AuditRecord second = fixtures.auditTrail.records().get(1);
        assertThat(first.operation()).isEqualTo("ECL calculation");
        assertThat(first.regulatoryReference()).isEqualTo(RegulatoryReference.IFRS_9);
        assertThat(first.inputDigest()).isEqualTo(second.inputDigest()).hasSize(64);
        assertThat(first.resultDigest()).isEqualTo(second.resultDigest());
    }

    @Test
    void missingInputsAreRejected() {
        assertThatThrownBy(() -> service.classifyAndQuantify(null, macro, Scenario.BASE))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> corporateLoan().annualPd(new BigDecimal("1.5")).build())
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("annualPd");
    }
}
