package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;

public record GuaranteeFundContribution(String insurer, int score, RiskClass riskClass, BigDecimal rate, BigDecimal amount) {
}
