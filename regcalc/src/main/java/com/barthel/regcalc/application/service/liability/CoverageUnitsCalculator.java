package com.barthel.regcalc.application.service.liability;

import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.exception.InvalidInputException;
import com.barthel.regcalc.domain.model.liability.CoverageUnitsBasis;
import com.barthel.regcalc.domain.model.liability.CoverageUnitsMethod;
import com.barthel.regcalc.domain.model.liability.CsmReleasePattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Coverage units per period and the CSM release they imply.
 */
@Component
@RequiredArgsConstructor
public class CoverageUnitsCalculator {

    private final CsmCalculator csmCalculator;
    private final Rounding rounding;

    public List<BigDecimal> coverageUnits(CoverageUnitsMethod method, CoverageUnitsBasis basis, int periods) {
        if (periods < 1) {
            throw new InvalidInputException("Coverage units need at least one period");
        }
        List<BigDecimal> units = switch (method) {
            case QUANTITY -> quantity(basis, periods);
            case EXPECTED_PERIOD -> expectedPeriod(basis, periods);
            case TIME_WEIGHTED -> timeWeighted(basis, periods);
            case PREMIUM_PATTERN -> premiumPattern(basis, periods);
        };
        return units.stream().map(rounding::ratio).toList();
    }

    /**
     * Releases {@code csm} over {@code units}, each period taking its share of the units still remaining.
     */
    public CsmReleasePattern releasePattern(BigDecimal csm, List<BigDecimal> units) {
        BigDecimal remaining = units.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal balance = csm;
        List<BigDecimal> releases = new ArrayList<>(units.size());
        List<BigDecimal> balances = new ArrayList<>(units.size());
        for (BigDecimal current : units) {
            BigDecimal release = rounding.money(csmCalculator.release(balance, current, remaining));
            balance = balance.subtract(release);
            remaining = remaining.subtract(current);
            releases.add(release);
            balances.add(rounding.money(balance));
        }
        return new CsmReleasePattern(units, releases, balances);
    }

    private List<BigDecimal> quantity(CoverageUnitsBasis basis, int periods) {
        BigDecimal survival = BigDecimal.ONE.subtract(basis.mortalityRate());
        List<BigDecimal> units = new ArrayList<>(periods);
        for (int t = 1; t <= periods; t++) {
            units.add(basis.sumInsured().multiply(survival.pow(t, Rounding.WORKING)));
        }
        return units;
    }

    private List<BigDecimal> expectedPeriod(CoverageUnitsBasis basis, int periods) {
        BigDecimal persistency = BigDecimal.ONE.subtract(basis.lapseRate());
        List<BigDecimal> units = new ArrayList<>(periods);
        for (int t = 1; t <= periods; t++) {
            units.add(persistency.pow(t - 1, Rounding.WORKING));
        }
        return units;
    }

    private List<BigDecimal> timeWeighted(CoverageUnitsBasis basis, int periods) {
        BigDecimal growth = BigDecimal.ONE.add(basis.expectedReturn());
        List<BigDecimal> units = new ArrayList<>(periods);
        for (int t = 1; t <= periods; t++) {
            units.add(basis.sumInsured().multiply(growth.pow(t - 1, Rounding.WORKING)));
        }
        return units;
    }

    private List<BigDecimal> premiumPattern(CoverageUnitsBasis basis, int periods) {
        if (basis.premiumPattern() == null) {
            return Collections.nCopies(periods, BigDecimal.ONE);
        }
        List<BigDecimal> units = new ArrayList<>(basis.premiumPattern());
        while (units.size() < periods) {
            units.add(BigDecimal.ZERO);
        }
        return units.subList(0, periods);
    }
}
