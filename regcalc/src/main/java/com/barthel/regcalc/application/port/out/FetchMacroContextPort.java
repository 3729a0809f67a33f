package com.barthel.regcalc.application.port.out;

import com.barthel.regcalc.domain.model.common.MacroContext;

import java.time.LocalDate;

/**
 * Port for obtaining the macroeconomic snapshot of a valuation date.
 */
public interface FetchMacroContextPort {
    /**
     * Fetch the macro context valid on the given date.
     *
     * @param valuationDate the valuation date
     * @return the immutable context
     */
    MacroContext fetchMacroContext(LocalDate valuationDate);
}
