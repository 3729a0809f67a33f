package com.barthel.regcalc.application.service.liability;

import com.barthel.regcalc.EngineFixtures;
import com.barthel.regcalc.domain.model.liability.CoverageUnitsBasis;
import com.barthel.regcalc.domain.model.liability.CoverageUnitsMethod;
import com.barthel.regcalc.domain.model.liability.CsmReleasePattern;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CoverageUnitsCalculatorTest {

    private final CoverageUnitsCalculator calculator = new EngineFixtures().coverageUnitsCalculator;

    @Test
    void quantityOfBenefitsDecaysWithMortality() {
        CoverageUnitsBasis basis = CoverageUnitsBasis.builder()
                .sumInsured(new BigDecimal("1000"))
                .mortalityRate(new BigDecimal("0.1"))
                .build();

        assertThat(calculator.coverageUnits(CoverageUnitsMethod.QUANTITY, basis, 2))
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("900"), new BigDecimal("810"));
    }

    @Test
    void expectedPeriodFollowsPersistency() {
        CoverageUnitsBasis basis = CoverageUnitsBasis.builder().build();

        assertThat(calculator.coverageUnits(CoverageUnitsMethod.EXPECTED_PERIOD, basis, 3))
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(BigDecimal.ONE, new BigDecimal("0.95"), new BigDecimal("0.9025"));
    }

    @Test
    void timeWeightedGrowsWithExpectedReturn() {
        CoverageUnitsBasis basis = CoverageUnitsBasis.builder()
                .sumInsured(new BigDecimal("100"))
                .expectedReturn(new BigDecimal("0.1"))
                .build();

        assertThat(calculator.coverageUnits(CoverageUnitsMethod.TIME_WEIGHTED, basis, 3))
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("100"), new BigDecimal("110"), new BigDecimal("121"));
    }

    @Test
    void premiumPatternIsPaddedOrUniform() {
        CoverageUnitsBasis pattern = CoverageUnitsBasis.builder()
                .premiumPattern(List.of(new BigDecimal("2"), BigDecimal.ONE))
                .build();

        assertThat(calculator.coverageUnits(CoverageUnitsMethod.PREMIUM_PATTERN, pattern, 3))
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("2"), BigDecimal.ONE, BigDecimal.ZERO);
        assertThat(calculator.coverageUnits(CoverageUnitsMethod.PREMIUM_PATTERN, CoverageUnitsBasis.builder().build(), 2))
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(BigDecimal.ONE, BigDecimal.ONE);
    }

    @Test
    void releasePatternExhaustsTheMargin() {
        CsmReleasePattern pattern = calculator.releasePattern(new BigDecimal("300"),
                List.of(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE));

        assertThat(pattern.releases()).usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("100"), new BigDecimal("100"), new BigDecimal("100"));
        assertThat(pattern.closingBalances().get(2)).isZero();
    }
}
