package com.barthel.regcalc.config;

import com.barthel.regcalc.domain.model.solvency.RiskClass;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "regcalc.guarantee-fund")
public class GuaranteeFundProperties {

    @NotEmpty
    private Map<RiskClass, BigDecimal> contributionRates = new EnumMap<>(Map.of(
            RiskClass.LOW_RISK, new BigDecimal("0.005"),
            RiskClass.MEDIUM_RISK, new BigDecimal("0.010"),
            RiskClass.HIGH_RISK, new BigDecimal("0.020")));

    /** Required fund over expected claims. */
    @NotNull
    private BigDecimal adequacyRatio = new BigDecimal("1.20");

    /** Adequacy reported when no claims are expected. */
    @NotNull
    private BigDecimal adequacyWithoutClaims = BigDecimal.TEN;

    /** Fund assumed available as a share of total reserves. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal fundShareOfReserves = new BigDecimal("0.10");

    @DecimalMin("0")
    @DecimalMax(value = "1", inclusive = false)
    private double defaultCorrelation = 0.30;

    @Min(1)
    private int simulations = 1000;

    @Min(1)
    private int maxSimulations = 10_000;

    private long seed = 42L;
}
