package com.barthel.regcalc.domain.model.credit;

import com.barthel.regcalc.domain.exception.InvalidInputException;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A single credit exposure as supplied by the portfolio. Never mutated by the
 * engine.
 *
 * @param id portfolio identifier, reported back on failures
 * @param grossCarryingAmount gross carrying amount (GCA)
 * @param annualPd current annual probability of default
 * @param pdAtOrigination annual PD at initial recognition
 * @param lgd loss given default; {@code null} takes the default for the collateral type
 * @param effectiveInterestRate effective interest rate used for discounting
 * @param remainingTerm remaining term in periods
 * @param daysPastDue days past due
 * @param collateral collateral descriptor
 * @param undrawnAmount undrawn commitment
 * @param facilityType off-balance facility type of the undrawn amount
 * @param creditEvents qualitative flags
 */
@Builder(toBuilder = true)
public record Exposure(
        String id,
        BigDecimal grossCarryingAmount,
        BigDecimal annualPd,
        BigDecimal pdAtOrigination,
        BigDecimal lgd,
        BigDecimal effectiveInterestRate,
        int remainingTerm,
        int daysPastDue,
        Collateral collateral,
        BigDecimal undrawnAmount,
        FacilityType facilityType,
        Set<CreditEvent> creditEvents) {

    public Exposure {
        if (id == null || id.isBlank()) {
            throw new InvalidInputException("Exposure id is required");
        }
        requireNonNegative(id, "grossCarryingAmount", grossCarryingAmount);
        requireProbability(id, "annualPd", annualPd);
        requireProbability(id, "pdAtOrigination", pdAtOrigination);
        if (lgd != null) {
            requireProbability(id, "lgd", lgd);
        }
        requireNonNegative(id, "effectiveInterestRate", effectiveInterestRate);
        if (remainingTerm < 0) {
            throw new InvalidInputException(id + ": remainingTerm must not be negative");
        }
        if (daysPastDue < 0) {
            throw new InvalidInputException(id + ": daysPastDue must not be negative");
        }
        collateral = collateral == null ? Collateral.none() : collateral;
        undrawnAmount = undrawnAmount == null ? BigDecimal.ZERO : undrawnAmount;
        requireNonNegative(id, "undrawnAmount", undrawnAmount);
        facilityType = facilityType == null ? FacilityType.CREDIT_LINE : facilityType;
        EnumSet<CreditEvent> events = EnumSet.noneOf(CreditEvent.class);
        if (creditEvents != null) {
            events.addAll(creditEvents);
        }
        creditEvents = Collections.unmodifiableSet(events);
    }

    public boolean has(CreditEvent event) {
        return creditEvents.contains(event);
    }

    private static void requireNonNegative(String id, String field, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new InvalidInputException(id + ": " + field + " must be a non-negative amount");
        }
    }

    private static void requireProbability(String id, String field, BigDecimal value) {
        if (value == null || value.signum() < 0 || value.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidInputException(id + ": " + field + " must be within [0, 1] but was " + value);
        }
    }
}
