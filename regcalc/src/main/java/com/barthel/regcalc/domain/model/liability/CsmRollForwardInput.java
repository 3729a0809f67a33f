package com.barthel.regcalc.domain.model.liability;

import com.barthel.regcalc.domain.exception.InvalidInputException;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Movements of one reporting period for a CSM roll-forward. General-model
 * roll-forwards use {@code interestRate} and {@code changesInFutureService};
 * variable-fee roll-forwards use {@code changeInUnderlyingFairValue} and
 * {@code nonVariableFcfChanges} instead.
 *
 * @param model GMM or VFA
 * @param opening opening CSM
 * @param newBusiness CSM of contracts added in the period
 * @param interestRate locked-in accretion rate
 * @param changesInFutureService changes in fulfilment cash flows relating to future service
 * @param changeInUnderlyingFairValue entity share of the change in fair value of underlying items
 * @param nonVariableFcfChanges fulfilment cash-flow changes not varying with underlying items
 * @param currencyEffect FX translation effect
 * @param coverageUnitsCurrent coverage units provided in the period
 * @param coverageUnitsRemaining coverage units of the period and all later periods
 */
@Builder
public record CsmRollForwardInput(
        MeasurementModel model,
        BigDecimal opening,
        BigDecimal newBusiness,
        BigDecimal interestRate,
        BigDecimal changesInFutureService,
        BigDecimal changeInUnderlyingFairValue,
        BigDecimal nonVariableFcfChanges,
        BigDecimal currencyEffect,
        BigDecimal coverageUnitsCurrent,
        BigDecimal coverageUnitsRemaining) {

    public CsmRollForwardInput {
        if (model == null || model == MeasurementModel.PAA) {
            throw new InvalidInputException("CSM roll-forward applies to GMM or VFA, got " + model);
        }
        if (opening == null || opening.signum() < 0) {
            throw new InvalidInputException("Opening CSM must be a non-negative amount");
        }
        newBusiness = orZero(newBusiness);
        interestRate = orZero(interestRate);
        changesInFutureService = orZero(changesInFutureService);
        changeInUnderlyingFairValue = orZero(changeInUnderlyingFairValue);
        nonVariableFcfChanges = orZero(nonVariableFcfChanges);
        currencyEffect = orZero(currencyEffect);
        coverageUnitsCurrent = orZero(coverageUnitsCurrent);
        coverageUnitsRemaining = orZero(coverageUnitsRemaining);
        if (newBusiness.signum() < 0) {
            throw new InvalidInputException("New business CSM must not be negative");
        }
        if (coverageUnitsCurrent.signum() < 0 || coverageUnitsRemaining.signum() < 0) {
            throw new InvalidInputException("Coverage units must not be negative");
        }
        if (coverageUnitsCurrent.compareTo(coverageUnitsRemaining) > 0 && coverageUnitsRemaining.signum() > 0) {
            throw new InvalidInputException("Current coverage units exceed remaining coverage units");
        }
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
