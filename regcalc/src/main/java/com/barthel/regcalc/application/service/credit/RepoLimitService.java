package com.barthel.regcalc.application.service.credit;

import com.barthel.regcalc.config.CreditRiskProperties;
import com.barthel.regcalc.domain.calc.Rounding;
import com.barthel.regcalc.domain.model.credit.RepoLimitCheck;
import com.barthel.regcalc.domain.model.credit.RepoPosition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Checks repo exposure against the limit in force on the valuation date and
 * prices the own-funds penalty for any excess.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RepoLimitService {

    private final CreditRiskProperties properties;
    private final Rounding rounding;

    public RepoLimitCheck check(RepoPosition position, LocalDate valuationDate) {
        CreditRiskProperties.Repo repo = properties.getRepo();
        BigDecimal limit = valuationDate.isBefore(repo.getLimitChangeDate())
                ? repo.getLimitBeforeChange()
                : repo.getLimitAfterChange();

        if (position.reserves().signum() == 0) {
            log.warn("Repo check on {} without reserves", valuationDate);
            return new RepoLimitCheck(valuationDate, null, limit, false, BigDecimal.ZERO, rounding.zeroMoney());
        }

        BigDecimal ratio = rounding.divide(position.repoAmount(), position.reserves());
        if (ratio.compareTo(limit) <= 0) {
            return new RepoLimitCheck(valuationDate, ratio, limit, true, BigDecimal.ZERO, rounding.zeroMoney());
        }
        BigDecimal excess = ratio.subtract(limit);
        BigDecimal penalty = rounding.money(excess.multiply(position.reserves()).multiply(repo.getPenaltyRate()));
        log.info("Repo limit breached on {}: ratio={} limit={} penalty={}", valuationDate, ratio, limit, penalty);
        return new RepoLimitCheck(valuationDate, ratio, limit, false, excess, penalty);
    }
}
