package com.barthel.regcalc.domain.model.solvency;

/**
 * Guarantee-fund risk class derived from an insurer score.
 */
public enum RiskClass {
    LOW_RISK,
    MEDIUM_RISK,
    HIGH_RISK
}
