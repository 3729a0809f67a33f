package com.barthel.regcalc.application.service.solvency;

import com.barthel.regcalc.EngineFixtures;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.solvency.MarketRiskExposure;
import com.barthel.regcalc.domain.model.solvency.ScrInput;
import com.barthel.regcalc.domain.model.solvency.ScrResult;
import com.barthel.regcalc.domain.model.solvency.UnderwritingRisk;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScrCalculatorTest {

    private final EngineFixtures fixtures = new EngineFixtures();

    @Test
    void modulesAggregateByRootSumOfSquaresWithCappedOperationalRisk() {
        ScrInput input = new ScrInput(
                new MarketRiskExposure(BigDecimal.ZERO, new BigDecimal("1200"), BigDecimal.ZERO, BigDecimal.ZERO),
                new UnderwritingRisk(new BigDecimal("400"), BigDecimal.ZERO, BigDecimal.ZERO),
                new BigDecimal("10000"),
                BigDecimal.ZERO);

        ScrResult result = fixtures.scrCalculator.calculate(input);

        assertThat(result.market()).isEqualByComparingTo("300");
        assertThat(result.underwriting()).isEqualByComparingTo("400");
        assertThat(result.basic()).isEqualByComparingTo("500");
        assertThat(result.operational()).isEqualByComparingTo("150");
        assertThat(result.total()).isEqualByComparingTo("650");
        assertThat(fixtures.auditTrail.size()).isEqualTo(1);
    }

    @Test
    void operationalRiskUsesLargerOfPremiumAndProvisionCharge() {
        ScrInput input = new ScrInput(
                new MarketRiskExposure(new BigDecimal("10000"), BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO),
                new UnderwritingRisk(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO),
                new BigDecimal("1000"),
                new BigDecimal("2000"));

        ScrResult result = fixtures.scrCalculator.calculate(input);

        assertThat(result.market()).isEqualByComparingTo("3900");
        assertThat(result.operational()).isEqualByComparingTo("60");
    }

    @Test
    void negativeExposureIsRejected() {
        assertThatThrownBy(() -> new ScrInput(
                new MarketRiskExposure(new BigDecimal("-1"), BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO),
                new UnderwritingRisk(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO),
                BigDecimal.ZERO, BigDecimal.ZERO))
                .isInstanceOf(InvalidInputException.class);
    }
}
