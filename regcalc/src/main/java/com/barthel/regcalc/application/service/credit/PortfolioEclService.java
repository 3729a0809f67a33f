package com.barthel.regcalc.application.service.credit;

import com.barthel.regcalc.application.port.in.AggregatePortfolioEclUseCase;
import com.barthel.regcalc.application.port.in.ClassifyAndQuantifyEclUseCase;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.model.common.MacroContext;
import com.barthel.regcalc.domain.model.common.Scenario;
import com.barthel.regcalc.domain.model.credit.EclResult;
import com.barthel.regcalc.domain.model.credit.Exposure;
import com.barthel.regcalc.domain.model.credit.ExposureFailure;
import com.barthel.regcalc.domain.model.credit.ImpairmentStage;
import com.barthel.regcalc.domain.model.credit.PortfolioEclSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Map-reduce over a credit portfolio. Exposures are computed in parallel;
 * a failing exposure is recorded and excluded while the rest complete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PortfolioEclService implements AggregatePortfolioEclUseCase {

    private final ClassifyAndQuantifyEclUseCase classifyAndQuantifyEclUseCase;
    private final Rounding rounding;

    @Override
    public PortfolioEclSummary aggregate(List<Exposure> exposures, MacroContext macroContext, Scenario scenario) {
        List<Outcome> outcomes = exposures.parallelStream()
                .map(exposure -> compute(exposure, macroContext, scenario))
                .toList();

        List<EclResult> results = new ArrayList<>();
        List<ExposureFailure> failures = new ArrayList<>();
        Map<ImpairmentStage, BigDecimal> eclByStage = new EnumMap<>(ImpairmentStage.class);
        Map<ImpairmentStage, Integer> countByStage = new EnumMap<>(ImpairmentStage.class);
        for (ImpairmentStage stage : ImpairmentStage.values()) {
            eclByStage.put(stage, rounding.zeroMoney());
            countByStage.put(stage, 0);
        }

        BigDecimal totalEcl = rounding.zeroMoney();
        BigDecimal totalGca = rounding.zeroMoney();
        for (int i = 0; i < outcomes.size(); i++) {
            Outcome outcome = outcomes.get(i);
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
                continue;
            }
            EclResult result = outcome.result();
            results.add(result);
            totalEcl = totalEcl.add(result.ecl());
            totalGca = totalGca.add(rounding.money(exposures.get(i).grossCarryingAmount()));
            eclByStage.merge(result.stage(), result.ecl(), BigDecimal::add);
            countByStage.merge(result.stage(), 1, Integer::sum);
        }

        BigDecimal coverage = totalGca.signum() > 0
                ? rounding.divide(totalEcl, totalGca)
                : rounding.ratio(BigDecimal.ZERO);

        log.info("Portfolio ECL items={} failed={} totalEcl={} coverage={}",
                exposures.size(), failures.size(), totalEcl, coverage);
        return new PortfolioEclSummary(results, failures, totalEcl, totalGca, eclByStage, countByStage, coverage);
    }

    private Outcome compute(Exposure exposure, MacroContext macroContext, Scenario scenario) {
        String id = exposure == null ? "<missing>" : exposure.id();
        try {
            return new Outcome(classifyAndQuantifyEclUseCase.classifyAndQuantify(exposure, macroContext, scenario), null);
        } catch (RuntimeException e) {
            log.warn("ECL failed for exposure {}: {}", id, e.getMessage());
            return new Outcome(null, new ExposureFailure(id, e.getMessage()));
        }
    }

    private record Outcome(EclResult result, ExposureFailure failure) {
    }
}
