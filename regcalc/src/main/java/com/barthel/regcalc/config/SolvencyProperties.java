package com.barthel.regcalc.config;

import com.barthel.regcalc.domain.model.solvency.InsurerClass;
import com.barthel.regcalc.domain.model.solvency.StressScenario;
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
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Minimum margin tiers, own-funds limits, SCR shocks and stress settings.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "regcalc.solvency")
public class SolvencyProperties {

    @Valid
    private Tier premiumTier = new Tier(new BigDecimal("0.18"), new BigDecimal("0.16"), new BigDecimal("3500000000"));

    @Valid
    private Tier claimsTier = new Tier(new BigDecimal("0.26"), new BigDecimal("0.23"), new BigDecimal("2500000000"));

    @Valid
    private Correction correction = new Correction();

    @NotNull
    private BigDecimal annuityAddonRate = new BigDecimal("0.08");

    @NotNull
    private BigDecimal mathematicalReserveAddonRate = new BigDecimal("0.03");

    /** Loading on the base margin when compulsory lines are written. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal compulsoryLoading = new BigDecimal("0.50");

    @NotEmpty
    private Map<InsurerClass, BigDecimal> guaranteedFund = new EnumMap<>(Map.of(
            InsurerClass.LIFE, new BigDecimal("1966000000"),
            InsurerClass.NON_LIFE, new BigDecimal("1966000000"),
            InsurerClass.REINSURANCE, new BigDecimal("13762000000")));

    /** Eligible subordinated debt as a share of pre-subordinated own funds. */
    @NotNull
    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal subordinatedDebtCap = new BigDecimal("0.50");

    @Valid
    private Scr scr = new Scr();

    @Valid
    private List<StressScenario> stressScenarios = new ArrayList<>(List.of(
            new StressScenario("base", BigDecimal.ZERO, BigDecimal.ZERO),
            new StressScenario("adverse", new BigDecimal("-0.20"), new BigDecimal("0.10")),
            new StressScenario("severe", new BigDecimal("-0.40"), new BigDecimal("0.20"))));

    @Valid
    private MonteCarlo monteCarlo = new MonteCarlo();

    /**
     * {@code rate1 * min(base, threshold) + rate2 * max(0, base - threshold)}.
     */
    @Data
    public static class Tier {
        @NotNull
        private BigDecimal firstRate;
        @NotNull
        private BigDecimal secondRate;
        @NotNull
        @DecimalMin("0")
        private BigDecimal threshold;

        public Tier() {
        }

        public Tier(BigDecimal firstRate, BigDecimal secondRate, BigDecimal threshold) {
            this.firstRate = firstRate;
            this.secondRate = secondRate;
            this.threshold = threshold;
        }
    }

    @Data
    public static class Correction {
        @NotNull
        private BigDecimal defaultCoefficient = new BigDecimal("0.70");
        @NotNull
        private BigDecimal minimum = new BigDecimal("0.50");
        @NotNull
        private BigDecimal maximum = new BigDecimal("0.85");
    }

    @Data
    public static class Scr {
        @NotNull
        private BigDecimal equityShock = new BigDecimal("0.39");
        @NotNull
        private BigDecimal propertyShock = new BigDecimal("0.25");
        @NotNull
        private BigDecimal interestShock = new BigDecimal("0.20");
        @NotNull
        private BigDecimal spreadShock = new BigDecimal("0.10");
        @NotNull
        private BigDecimal operationalCap = new BigDecimal("0.30");
        @NotNull
        private BigDecimal operationalPremiumRate = new BigDecimal("0.03");
        @NotNull
        private BigDecimal operationalProvisionRate = new BigDecimal("0.03");
    }

    @Data
    public static class MonteCarlo {
        @Min(1)
        private int simulations = 1000;
        @Min(1)
        private int maxSimulations = 10_000;
        private double ownFundsVolatility = 0.15;
        private double marginVolatility = 0.05;
        /** Lower quantile of the simulated ratio, 0.005 for a 99.5% view. */
        private double tailQuantile = 0.005;
        private long seed = 42L;
    }
}
