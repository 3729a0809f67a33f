package com.barthel.regcalc.domain.model.solvency;

import com.barthel.regcalc.domain.exception.InvalidInputException;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Balance-sheet items feeding eligible own funds.
 *
 * @param equity shareholders' equity
 * @param illiquidAssets deducted illiquid assets
 * @param intangibleAssets deducted intangible assets
 * @param subordinatedDebt subordinated debt, eligible up to the configured cap
 * @param repoPenalty penalty for repo limit breaches
 */
@Builder
public record OwnFundsInput(
        BigDecimal equity,
        BigDecimal illiquidAssets,
        BigDecimal intangibleAssets,
        BigDecimal subordinatedDebt,
        BigDecimal repoPenalty) {

    public OwnFundsInput {
        if (equity == null) {
            throw new InvalidInputException("Equity is required");
        }
        illiquidAssets = nonNegative("illiquidAssets", illiquidAssets);
        intangibleAssets = nonNegative("intangibleAssets", intangibleAssets);
        subordinatedDebt = nonNegative("subordinatedDebt", subordinatedDebt);
        repoPenalty = nonNegative("repoPenalty", repoPenalty);
    }

    public OwnFundsInput withRepoPenalty(BigDecimal penalty) {
        return new OwnFundsInput(equity, illiquidAssets, intangibleAssets, subordinatedDebt, penalty);
    }

    private static BigDecimal nonNegative(String field, BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() < 0) {
            throw new InvalidInputException(field + " must not be negative");
        }
        return value;
    }
}
