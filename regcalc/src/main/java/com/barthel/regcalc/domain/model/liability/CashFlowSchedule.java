package com.barthel.regcalc.domain.model.liability;

import com.barthel.regcalc.domain.exception.InvalidInputException;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Ordered cash-flow projection of a contract group.
 *
 * @param groupId contract group identifier
 * @param periods per-period cash flows, consecutive and starting at 1
 * @param lapseRate per-period lapse rate in [0, 1); {@code null} takes the configured default
 * @param features direct-participation features of the group
 */
@Builder
public record CashFlowSchedule(String groupId, List<CashFlow> periods, BigDecimal lapseRate, ParticipationFeatures features) {

    public CashFlowSchedule {
        if (groupId == null || groupId.isBlank()) {
            throw new InvalidInputException("Contract group id is required");
        }
        if (periods == null || periods.isEmpty()) {
            throw new InvalidInputException(groupId + ": cash-flow schedule must not be empty");
        }
        periods = List.copyOf(periods);
        for (int i = 0; i < periods.size(); i++) {
            if (periods.get(i).period() != i + 1) {
                throw new InvalidInputException(groupId + ": expected period " + (i + 1)
                        + " at position " + i + " but found " + periods.get(i).period());
            }
        }
        if (lapseRate != null && (lapseRate.signum() < 0 || lapseRate.compareTo(BigDecimal.ONE) >= 0)) {
            throw new InvalidInputException(groupId + ": lapse rate must be within [0, 1)");
        }
        features = features == null ? ParticipationFeatures.NONE : features;
    }

    public int term() {
        return periods.size();
    }

    public BigDecimal totalPremiums() {
        return periods.stream().map(CashFlow::premiums).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public List<BigDecimal> netOutflows() {
        return periods.stream().map(CashFlow::netOutflow).toList();
    }
}
