package com.barthel.regcalc.domain.model.credit;

import com.barthel.regcalc.domain.exception.InvalidInputException;

import java.math.BigDecimal;

/**
 * Outstanding repo exposure measured against insurance reserves.
 */
public record RepoPosition(BigDecimal repoAmount, BigDecimal reserves) {

    public RepoPosition {
        if (repoAmount == null || repoAmount.signum() < 0 || reserves == null || reserves.signum() < 0) {
            throw new InvalidInputException("Repo amount and reserves must be non-negative");
        }
    }
}
