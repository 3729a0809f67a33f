package com.barthel.regcalc.domain.model.solvency;

import java.math.BigDecimal;
import java.util.List;

public record GuaranteeFundAssessment(
        List<GuaranteeFundContribution> contributions,
        BigDecimal totalContributions,
        BankruptcySimulation simulation) {

    public GuaranteeFundAssessment {
        contributions = List.copyOf(contributions);
    }
}
