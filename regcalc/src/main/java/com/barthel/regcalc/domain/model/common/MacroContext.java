package com.barthel.regcalc.domain.model.common;

import com.barthel.regcalc.domain.exception.InvalidInputException;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable macroeconomic snapshot passed into every calculation.
 * Rates are fractions (0.18 for 18%).
 *
 * @param valuationDate date the snapshot refers to
 * @param baseRate central bank base rate
 * @param inflation annual inflation
 * @param gdpGrowth annual real GDP growth
 * @param fxRates currency code to local-currency rate
 * @param scenarioMultipliers PD multiplier per concrete scenario
 * @param scenarioWeights probability weight per concrete scenario, summing to 1
 */
@Builder(toBuilder = true)
public record MacroContext(
        LocalDate valuationDate,
        BigDecimal baseRate,
        BigDecimal inflation,
        BigDecimal gdpGrowth,
        Map<String, BigDecimal> fxRates,
        Map<Scenario, BigDecimal> scenarioMultipliers,
        Map<Scenario, BigDecimal> scenarioWeights) {

    private static final Set<Scenario> CONCRETE = EnumSet.of(Scenario.BASE, Scenario.ADVERSE, Scenario.SEVERE);

    public MacroContext {
        if (valuationDate == null) {
            throw new InvalidInputException("Valuation date is required");
        }
        if (baseRate == null || inflation == null) {
            throw new InvalidInputException("Base rate and inflation are required");
        }
        gdpGrowth = gdpGrowth == null ? BigDecimal.ZERO : gdpGrowth;
        fxRates = Collections.unmodifiableMap(new TreeMap<>(fxRates == null ? Map.of() : fxRates));
        scenarioMultipliers = concrete(scenarioMultipliers, "multipliers");
        scenarioWeights = concrete(scenarioWeights, "weights");

        scenarioMultipliers.forEach((scenario, multiplier) -> {
            if (multiplier.signum() <= 0) {
                throw new InvalidInputException("Multiplier for " + scenario + " must be positive");
            }
        });
        BigDecimal weightSum = BigDecimal.ZERO;
        for (BigDecimal weight : scenarioWeights.values()) {
            if (weight.signum() < 0) {
                throw new InvalidInputException("Scenario weights must not be negative");
            }
            weightSum = weightSum.add(weight);
        }
        if (weightSum.compareTo(BigDecimal.ONE) != 0) {
            throw new InvalidInputException("Scenario weights must sum to 1 but sum to " + weightSum);
        }
    }

    /**
     * PD multiplier for a scenario; {@link Scenario#WEIGHTED} returns
     * {@code sum(weight_i * multiplier_i)}.
     */
    public BigDecimal multiplier(Scenario scenario) {
        if (!scenario.isWeighted()) {
            return scenarioMultipliers.get(scenario);
        }
        BigDecimal blended = BigDecimal.ZERO;
        for (Scenario concrete : CONCRETE) {
            blended = blended.add(scenarioWeights.get(concrete).multiply(scenarioMultipliers.get(concrete)));
        }
        return blended;
    }

    public BigDecimal fxRate(String currency) {
        BigDecimal rate = fxRates.get(currency);
        if (rate == null) {
            throw new InvalidInputException("No FX rate for currency " + currency);
        }
        return rate;
    }

    private static Map<Scenario, BigDecimal> concrete(Map<Scenario, BigDecimal> values, String label) {
        if (values == null || !values.keySet().equals(CONCRETE)) {
            throw new InvalidInputException("Scenario " + label + " must cover exactly BASE, ADVERSE and SEVERE");
        }
        if (values.values().stream().anyMatch(v -> v == null)) {
            throw new InvalidInputException("Scenario " + label + " must not contain null values");
        }
        return Collections.unmodifiableMap(new EnumMap<>(values));
    }
}
