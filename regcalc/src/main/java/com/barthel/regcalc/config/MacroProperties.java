package com.barthel.regcalc.config;

import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.common.Scenario;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Macroeconomic snapshot served when no external feed is wired.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "regcalc.macro")
public class MacroProperties {

    @NotNull
    private LocalDate valuationDate = LocalDate.of(2025, 11, 1);

    @NotNull
    private BigDecimal baseRate = new BigDecimal("0.18");

    @NotNull
    private BigDecimal inflation = new BigDecimal("0.129");

    @NotNull
    private BigDecimal gdpGrowth = new BigDecimal("0.056");

    @NotEmpty
    private Map<String, BigDecimal> fxRates = new TreeMap<>(Map.of(
            "USD", new BigDecimal("560"),
            "EUR", new BigDecimal("590")));

    @NotEmpty
    private Map<Scenario, BigDecimal> scenarioMultipliers = new EnumMap<>(Map.of(
            Scenario.BASE, new BigDecimal("1.35"),
            Scenario.ADVERSE, new BigDecimal("1.80"),
            Scenario.SEVERE, new BigDecimal("2.40")));

    @NotEmpty
    private Map<Scenario, BigDecimal> scenarioWeights = new EnumMap<>(Map.of(
            Scenario.BASE, new BigDecimal("0.55"),
            Scenario.ADVERSE, new BigDecimal("0.35"),
            Scenario.SEVERE, new BigDecimal("0.10")));

    /**
     * Context for the configured snapshot, dated {@code date}.
     */
    public MacroContext toContext(LocalDate date) {
        return MacroContext.builder()
                .valuationDate(date)
                .baseRate(baseRate)
                .inflation(inflation)
                .gdpGrowth(gdpGrowth)
                .fxRates(fxRates)
                .scenarioMultipliers(scenarioMultipliers)
                .scenarioWeights(scenarioWeights)
                .build();
    }
}
