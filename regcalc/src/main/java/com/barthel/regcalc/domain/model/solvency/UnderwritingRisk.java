package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;

public record UnderwritingRisk(BigDecimal premiumRisk, BigDecimal reserveRisk, BigDecimal catastropheRisk) {
}
