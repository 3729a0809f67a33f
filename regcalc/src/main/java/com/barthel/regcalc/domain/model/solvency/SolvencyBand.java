package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;

public enum SolvencyBand {
    EXCELLENT(new BigDecimal("2.0")),
    GOOD(new BigDecimal("1.5")),
    ADEQUATE(BigDecimal.ONE),
    INSUFFICIENT(BigDecimal.ZERO);

    private final BigDecimal lowerBound;

    SolvencyBand(BigDecimal lowerBound) {
        this.lowerBound = lowerBound;
    }

    public static SolvencyBand of(BigDecimal ratio) {
        for (SolvencyBand band : values()) {
            if (band != INSUFFICIENT && ratio.compareTo(band.lowerBound) >= 0) {
                return band;
            }
        }
        return INSUFFICIENT;
    }
}
