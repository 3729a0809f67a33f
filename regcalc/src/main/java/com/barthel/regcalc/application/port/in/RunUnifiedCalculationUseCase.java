package com.barthel.regcalc.application.port.in;

import com.barthel.regcalc.domain.model.unified.UnifiedCalculationRequest;
import com.barthel.regcalc.domain.model.unified.UnifiedCalculationResult;

/**
 * Use case for running credit, liability and solvency in one pass.
 */
public interface RunUnifiedCalculationUseCase {
    /**
     * Resolves the macro context and runs all three engines in order.
     *
     * @param request the portfolio, contract groups and solvency bases
     * @return the combined result
     */
    UnifiedCalculationResult run(UnifiedCalculationRequest request);
}
