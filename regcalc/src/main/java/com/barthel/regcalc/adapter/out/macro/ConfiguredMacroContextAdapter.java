package com.barthel.regcalc.adapter.out.macro;

import com.barthel.regcalc.application.port.out.FetchMacroContextPort;
import com.barthel.regcalc.config.MacroProperties;
import com.barthel.regcalc.domain.model.common.MacroContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Serves the configured macro snapshot for any valuation date.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfiguredMacroContextAdapter implements FetchMacroContextPort {

    private final MacroProperties properties;

    @Override
    public MacroContext fetchMacroContext(LocalDate valuationDate) {
        if (!properties.getValuationDate().equals(valuationDate)) {
            log.info("Using macro snapshot of {} for valuation date {}", properties.getValuationDate(), valuationDate);
        }
        return properties.toContext(valuationDate);
    }
}
