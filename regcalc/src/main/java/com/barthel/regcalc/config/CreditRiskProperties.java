package com.barthel.regcalc.config;

import com.barthel.regcalc.domain.model.credit.CollateralType;
import com.barthel.regcalc.domain.model.credit.FacilityType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Staging thresholds and loss parameters of the ECL engine.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "regcalc.credit")
public class CreditRiskProperties {

    @Valid
    private Staging staging = new Staging();

    @NotEmpty
    private Map<CollateralType, BigDecimal> lgdByCollateral = new EnumMap<>(Map.of(
            CollateralType.UNSECURED, new BigDecimal("0.69"),
            CollateralType.REAL_ESTATE, new BigDecimal("0.35"),
            CollateralType.VEHICLES, new BigDecimal("0.50"),
            CollateralType.DEPOSITS, new BigDecimal("0.15"),
            CollateralType.SOVEREIGN, new BigDecimal("0.45")));

    @NotEmpty
    private Map<FacilityType, BigDecimal> ccfByFacility = new EnumMap<>(Map.of(
            FacilityType.CREDIT_LINE, new BigDecimal("0.50"),
            FacilityType.GUARANTEE, new BigDecimal("0.75"),
            FacilityType.LETTER_OF_CREDIT, new BigDecimal("0.60"),
            FacilityType.UNUSED_LIMIT, new BigDecimal("0.40")));

    @Valid
    private MacroLgd macroLgd = new MacroLgd();

    /** Maximum Stage 3 uplift, reached at {@link Staging#stageThreeDaysPastDue} days. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal stageThreeUplift = new BigDecimal("0.20");

    @Valid
    private LogisticPd logisticPd = new LogisticPd();

    @Valid
    private Repo repo = new Repo();

    @Data
    public static class Staging {
        @Min(0)
        private int stageTwoDaysPastDue = 30;
        @Min(0)
        private int stageThreeDaysPastDue = 90;
        /** Current PD over PD at origination above which credit risk increased significantly. */
        @NotNull
        @DecimalMin("1")
        private BigDecimal pdRatioThreshold = new BigDecimal("2.0");
        @NotNull
        @DecimalMin("0")
        private BigDecimal pdAbsoluteThreshold = new BigDecimal("0.005");
    }

    /**
     * LGD scaling {@code 1 + inflationSensitivity * (inflation - referenceInflation)
     * + rateSensitivity * (baseRate - referenceRate)}.
     */
    @Data
    public static class MacroLgd {
        @NotNull
        private BigDecimal inflationSensitivity = new BigDecimal("0.05");
        @NotNull
        private BigDecimal rateSensitivity = new BigDecimal("0.10");
        @NotNull
        private BigDecimal referenceInflation = new BigDecimal("0.05");
        @NotNull
        private BigDecimal referenceRate = new BigDecimal("0.10");
    }

    /**
     * Coefficients of {@code 1 / (1 + exp(-(intercept + gdp * GDP% + inflation * CPI%)))}.
     */
    @Data
    public static class LogisticPd {
        private double intercept = -3.5;
        private double gdpCoefficient = -0.15;
        private double inflationCoefficient = 0.08;
    }

    @Data
    public static class Repo {
        @NotNull
        @DecimalMin("0")
        @DecimalMax("1")
        private BigDecimal limitBeforeChange = new BigDecimal("0.50");
        @NotNull
        @DecimalMin("0")
        @DecimalMax("1")
        private BigDecimal limitAfterChange = new BigDecimal("0.35");
        @NotNull
        private LocalDate limitChangeDate = LocalDate.of(2025, 7, 1);
        @NotNull
        @DecimalMin("0")
        private BigDecimal penaltyRate = new BigDecimal("0.05");
    }
}
