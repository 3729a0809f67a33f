package com.barthel.regcalc.domain.model.liability;

import com.barthel.regcalc.domain.exception.InvalidInputException;

import java.math.BigDecimal;

/**
 * A contract group queued for measurement in a unified run.
 */
public record ContractGroupRequest(
        CashFlowSchedule schedule,
        BigDecimal acquisitionCosts,
        RaMethod raMethod,
        MeasurementModel model) {

    public ContractGroupRequest {
        if (schedule == null || raMethod == null || model == null) {
            throw new InvalidInputException("Schedule, RA method and measurement model are required");
        }
        acquisitionCosts = acquisitionCosts == null ? BigDecimal.ZERO : acquisitionCosts;
    }
}
