package com.barthel.regcalc.config;

import com.barthel.regcalc.domain.calc.Rounding;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.RoundingMode;

/**
 * Precision shared by every engine.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "regcalc.rounding")
public class RoundingProperties {

    /** Decimals kept on currency amounts. */
    @Min(0)
    @Max(8)
    private int currencyScale = 3;

    /** Decimals kept on ratios, rates and probabilities. */
    @Min(0)
    @Max(20)
    private int ratioScale = 10;

    @NotNull
    private RoundingMode mode = RoundingMode.HALF_UP;

    public Rounding toRounding() {
        return new Rounding(currencyScale, ratioScale, mode);
    }
}
