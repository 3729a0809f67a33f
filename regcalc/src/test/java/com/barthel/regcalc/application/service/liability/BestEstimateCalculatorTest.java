package com.barthel.regcalc.application.service.liability;

import com.barthel.regcalc.EngineFixtures;
import com.barthel.regcalc.domain.model.common.DiscountForm;
import com.barthel.regcalc.domain.model.liability.BelResult;
import com.barthel.regcalc.domain.model.liability.CashFlow;
import com.barthel.regcalc.domain.model.liability.CashFlowSchedule;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BestEstimateCalculatorTest {

    private final EngineFixtures fixtures = new EngineFixtures();
    private final BestEstimateCalculator calculator = fixtures.bestEstimateCalculator;

    private static CashFlowSchedule claimsOnly(String first, String second) {
        return CashFlowSchedule.builder()
                .groupId("G-1")
                .periods(List.of(
                        new CashFlow(1, null, new BigDecimal(first), null, null),
                        new CashFlow(2, null, new BigDecimal(second), null, null)))
                .build();
    }

    @Test
    void discountsNetOutflowsWithoutLapses() {
        BelResult result = calculator.calculate(claimsOnly("110", "121"), BigDecimal.ZERO,
                new BigDecimal("0.10"), DiscountForm.DISCRETE);

        assertThat(result.bel()).isEqualByComparingTo("200");
        assertThat(result.periods()).hasSize(2);
        assertThat(result.periods().get(1).presentValue()).isEqualByComparingTo("100");
    }

    @Test
    void continuousFormMatchesDiscreteAtSameRate() {
        BelResult discrete = calculator.calculate(claimsOnly("110", "121"), BigDecimal.ZERO,
                new BigDecimal("0.10"), DiscountForm.DISCRETE);
        BelResult continuous = calculator.calculate(claimsOnly("110", "121"), BigDecimal.ZERO,
                new BigDecimal("0.10"), DiscountForm.CONTINUOUS);

        assertThat(continuous.bel()).isEqualByComparingTo(discrete.bel()).isEqualByComparingTo("200");
        assertThat(continuous.periods().get(1).discountFactor())
                .isEqualByComparingTo(discrete.periods().get(1).discountFactor());
    }

    @Test
    void lapsesReduceLaterPeriodsOnly() {
        BelResult result = calculator.calculate(claimsOnly("110", "121"), new BigDecimal("0.10"),
                new BigDecimal("0.10"), DiscountForm.DISCRETE);

        assertThat(result.periods().get(0).survivalFactor()).isEqualByComparingTo("1");
        assertThat(result.periods().get(1).survivalFactor()).isEqualByComparingTo("0.9");
        assertThat(result.bel()).isEqualByComparingTo("190");
    }

    @Test
    void premiumsInExcessOfOutgoGiveNegativeBestEstimate() {
        CashFlowSchedule schedule = CashFlowSchedule.builder()
                .groupId("G-2")
                .periods(List.of(new CashFlow(1, new BigDecimal("500"), new BigDecimal("100"),
                        new BigDecimal("20"), BigDecimal.ZERO)))
                .build();

        BelResult result = calculator.calculate(schedule, BigDecimal.ZERO, BigDecimal.ZERO, DiscountForm.CONTINUOUS);

        assertThat(result.bel()).isEqualByComparingTo("-380");
    }
}
