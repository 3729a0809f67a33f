package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;

public record StressedRatio(String scenario, BigDecimal ownFunds, BigDecimal minimumMargin, BigDecimal ratio, boolean compliant) {
}
