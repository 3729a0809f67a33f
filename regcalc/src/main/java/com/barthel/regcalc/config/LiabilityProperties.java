package com.barthel.regcalc.config;

import com.barthel.regcalc.domain.model.common.DiscountForm;
import com.barthel.regcalc.domain.model.liability.RaMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Discounting and risk-adjustment parameters of the liability engine.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "regcalc.liability")
public class LiabilityProperties {

    @Valid
    private Discount discount = new Discount();

    /** Lapse rate applied when a schedule does not carry one. */
    @NotNull
    @DecimalMin("0")
    @DecimalMax(value = "1", inclusive = false)
    private BigDecimal defaultLapseRate = new BigDecimal("0.05");

    @Valid
    private RiskAdjustment riskAdjustment = new RiskAdjustment();

    @Data
    public static class Discount {
        @NotNull
        private DiscountForm form = DiscountForm.CONTINUOUS;
        @NotNull
        @DecimalMin("0")
        private BigDecimal illiquidityPremium = new BigDecimal("0.005");
        /** Share of the illiquidity premium for terms up to three periods. */
        @NotNull
        private BigDecimal shortTermFactor = new BigDecimal("0.80");
        /** Share for a four-period term. */
        @NotNull
        private BigDecimal mediumTermFactor = new BigDecimal("0.75");
        /** Share for five periods and longer. */
        @NotNull
        private BigDecimal longTermFactor = new BigDecimal("0.70");
    }

    @Data
    public static class RiskAdjustment {
        @NotEmpty
        private Map<RaMethod, BigDecimal> confidenceLevels = new EnumMap<>(Map.of(
                RaMethod.VAR, new BigDecimal("0.95"),
                RaMethod.TVAR, new BigDecimal("0.90"),
                RaMethod.CTE, new BigDecimal("0.90")));
        @NotNull
        @DecimalMin("0")
        private BigDecimal costOfCapitalRate = new BigDecimal("0.065");
        /** Capital requirement as a share of BEL when none is supplied. */
        @NotNull
        @DecimalMin("0")
        private BigDecimal capitalFactor = new BigDecimal("0.10");
        @Min(1)
        private int simulations = 1000;
        @Min(1)
        @Max(1_000_000)
        private int maxSimulations = 10_000;
        private long seed = 42L;
        /** Pairwise correlations keyed {@code "riskA:riskB"}. */
        private Map<String, BigDecimal> correlations = new LinkedHashMap<>(Map.of(
                "mortality:lapse", new BigDecimal("0.50"),
                "mortality:morbidity", new BigDecimal("0.25"),
                "lapse:expense", new BigDecimal("0.30")));
        @NotNull
        @DecimalMin("-1")
        @DecimalMax("1")
        private BigDecimal defaultCorrelation = new BigDecimal("0.25");
    }
}
