package com.barthel.regcalc.application.service.solvency;

import com.barthel.regcalc.EngineFixtures;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.solvency.BankruptcySimulation;
import com.barthel.regcalc.domain.model.solvency.GuaranteeFundAssessment;
import com.barthel.regcalc.domain.model.solvency.GuaranteeFundContribution;
import com.barthel.regcalc.domain.model.solvency.InsurerProfile;
import com.barthel.regcalc.domain.model.solvency.RiskClass;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuaranteeFundServiceTest {

    private final EngineFixtures fixtures = new EngineFixtures();
    private final GuaranteeFundService service = fixtures.guaranteeFundService;

    private static InsurerProfile.InsurerProfileBuilder insurer(String name) {
        return InsurerProfile.builder()
                .name(name)
                .grossPremiums(new BigDecimal("1000000"))
                .reserves(new BigDecimal("5000000"));
    }

    private final InsurerProfile strong = insurer("Strong")
            .solvencyRatio(new BigDecimal("2.1"))
            .lossRatio(new BigDecimal("0.5"))
            .combinedRatio(new BigDecimal("0.85"))
            .yearsInMarket(12)
            .build();

    @Test
    void wellRunInsurerPaysLowRiskRate() {
        GuaranteeFundContribution contribution = service.contribution(strong);

        assertThat(contribution.score()).isEqualTo(8);
        assertThat(contribution.riskClass()).isEqualTo(RiskClass.LOW_RISK);
        assertThat(contribution.amount()).isEqualByComparingTo("5000");
    }

    @Test
    void scoresMapToRiskClasses() {
        InsurerProfile medium = insurer("Medium")
                .solvencyRatio(new BigDecimal("1.6"))
                .lossRatio(new BigDecimal("0.7"))
                .combinedRatio(new BigDecimal("0.95"))
                .yearsInMarket(5)
                .build();
        InsurerProfile weak = insurer("Weak").build();

        assertThat(service.score(medium)).isEqualTo(4);
        assertThat(service.contribution(medium).riskClass()).isEqualTo(RiskClass.MEDIUM_RISK);
        assertThat(service.score(weak)).isZero();
        assertThat(service.contribution(weak).amount()).isEqualByComparingTo("20000");
    }

    @Test
    void emptyMarketYieldsEmptySimulation() {
        GuaranteeFundAssessment assessment = service.assess(List.of());

        assertThat(assessment.contributions()).isEmpty();
        assertThat(assessment.totalContributions()).isZero();
        assertThat(assessment.simulation().isEmpty()).isTrue();
    }

    @Test
    void insurersThatCannotFailCostNothing() {
        BankruptcySimulation simulation = service.simulate(
                List.of(insurer("Safe").probabilityOfDefault(BigDecimal.ZERO).build()), 0.3);

        assertThat(simulation.expectedClaims()).isZero();
        assertThat(simulation.probabilityOfShortfall()).isZero();
        assertThat(simulation.fundAdequacy()).isEqualByComparingTo("10");
        assertThat(simulation.adequate()).isTrue();
    }

    @Test
    void certainFailureExhaustsTheFund() {
        BankruptcySimulation simulation = service.simulate(
                List.of(insurer("Doomed").probabilityOfDefault(BigDecimal.ONE).build()), 0.3);

        assertThat(simulation.expectedClaims()).isEqualByComparingTo("3500000");
        assertThat(simulation.valueAtRisk99()).isEqualByComparingTo("3500000");
        assertThat(simulation.assumedFund()).isEqualByComparingTo("500000");
        assertThat(simulation.probabilityOfShortfall()).isEqualByComparingTo("1");
        assertThat(simulation.adequate()).isFalse();
    }

    @Test
    void simulationIsReproducibleAndOrdered() {
        List<InsurerProfile> market = List.of(strong, insurer("B").probabilityOfDefault(new BigDecimal("0.10")).build(),
                insurer("C").probabilityOfDefault(new BigDecimal("0.20")).build());

        BankruptcySimulation first = service.simulate(market, 0.3);
        BankruptcySimulation second = service.simulate(market, 0.3);

        assertThat(second).isEqualTo(first);
        assertThat(first.valueAtRisk99()).isGreaterThanOrEqualTo(first.valueAtRisk95());
        assertThat(first.expectedClaims()).isPositive();
    }

    @Test
    void correlationMustBeBelowOne() {
        assertThatThrownBy(() -> service.simulate(List.of(strong), 1.0))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void assessmentIsAudited() {
        GuaranteeFundAssessment assessment = service.assess(List.of(strong));

        assertThat(assessment.totalContributions()).isEqualByComparingTo("5000");
        assertThat(fixtures.auditTrail.records()).hasSize(1);
    }
}
