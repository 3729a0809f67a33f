package com.barthel.regcalc.application.service.credit;

import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.common.Scenario;
import com.barthel.regcalc.domain.model.credit.EclStressResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Stream;

/**
 * Scales a base ECL by each concrete scenario multiplier.
 */
@Service
@RequiredArgsConstructor
public class EclStressTestService {

    private static final BigDecimal PERCENT = BigDecimal.valueOf(100);

    private final Rounding rounding;

    public List<EclStressResult> stress(BigDecimal baseEcl, MacroContext macroContext) {
        return Stream.of(Scenario.BASE, Scenario.ADVERSE, Scenario.SEVERE)
                .map(scenario -> {
                    BigDecimal multiplier = macroContext.multiplier(scenario);
                    return new EclStressResult(
                            scenario,
                            multiplier,
                            rounding.money(baseEcl.multiply(multiplier)),
                            multiplier.subtract(BigDecimal.ONE).multiply(PERCENT));
                })
                .toList();
    }
}
