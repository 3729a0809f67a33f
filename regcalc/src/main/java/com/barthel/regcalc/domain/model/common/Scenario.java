package com.barthel.regcalc.domain.model.common;

/**
 * Forward-looking macro scenario. {@link #WEIGHTED} blends the three concrete
 * scenarios by their probability weights.
 */
public enum Scenario {
    BASE,
    ADVERSE,
    SEVERE,
    WEIGHTED;

    public boolean isWeighted() {
        return this == WEIGHTED;
    }
}
