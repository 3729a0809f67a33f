package com.barthel.regcalc.domain.model.credit;

/**
 * Collateral category driving the base LGD.
 */
public enum CollateralType {
    UNSECURED,
    REAL_ESTATE,
    VEHICLES,
    DEPOSITS,
    SOVEREIGN
}
