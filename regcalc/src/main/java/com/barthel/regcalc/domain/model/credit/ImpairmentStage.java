package com.barthel.regcalc.domain.model.credit;

/**
 * Three-stage impairment classification. Stage 1 measures a 12-month loss,
 * stages 2 and 3 a lifetime loss.
 */
public enum ImpairmentStage {
    STAGE_1(1),
    STAGE_2(2),
    STAGE_3(3);

    private final int number;

    ImpairmentStage(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    public boolean isLifetime() {
        return this != STAGE_1;
    }
}
