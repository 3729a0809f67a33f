package com.barthel.regcalc.domain.model.credit;

import com.barthel.regcalc.domain.exception.InvalidInputException;

import java.util.List;

/**
 * Outcome of stage classification with the triggers that fired.
 *
 * @param stage resulting stage
 * @param triggers human-readable triggers, empty for stage 1
 */
public record StageAssessment(ImpairmentStage stage, List<String> triggers) {
    public StageAssessment {
        if (stage == null) {
            throw new InvalidInputException("Stage is required");
        }
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
    }
}
