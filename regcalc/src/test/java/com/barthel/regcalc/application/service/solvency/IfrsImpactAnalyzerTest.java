package com.barthel.regcalc.application.service.solvency;

import com.barthel.regcalc.EngineFixtures;
import com.barthel.regcalc.domain.model.solvency.IfrsImpact;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class IfrsImpactAnalyzerTest {

    private final IfrsImpactAnalyzer analyzer = new EngineFixtures().ifrsImpactAnalyzer;

    @Test
    void reportsRatioBeforeAndAfterIfrsEffects() {
        IfrsImpact impact = analyzer.analyze(new BigDecimal("1000"), new BigDecimal("500"),
                new BigDecimal("100"), new BigDecimal("300"), new BigDecimal("100"));

        assertThat(impact.preRatio()).isEqualByComparingTo("2");
        assertThat(impact.postOwnFunds()).isEqualByComparingTo("1200");
        assertThat(impact.postMargin()).isEqualByComparingTo("400");
        assertThat(impact.postRatio()).isEqualByComparingTo("3");
        assertThat(impact.ratioChangePoints()).isEqualByComparingTo("100");
    }
}
