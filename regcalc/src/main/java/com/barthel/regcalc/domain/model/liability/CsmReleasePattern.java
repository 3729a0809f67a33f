package com.barthel.regcalc.domain.model.liability;

import java.math.BigDecimal;
import java.util.List;

/**
 * Projected release of a CSM balance over coverage units.
 *
 * @param coverageUnits units per period
 * @param releases release per period
 * @param closingBalances balance after each release
 */
public record CsmReleasePattern(List<BigDecimal> coverageUnits, List<BigDecimal> releases, List<BigDecimal> closingBalances) {
    public CsmReleasePattern {
        coverageUnits = List.copyOf(coverageUnits);
        releases = List.copyOf(releases);
        closingBalances = List.copyOf(closingBalances);
    }
}
