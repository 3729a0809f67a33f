package com.barthel.regcalc.domain.model.liability;

/**
 * Insurance-contract measurement model.
 */
public enum MeasurementModel {
    /** General measurement model: BEL, RA and CSM. */
    GMM,
    /** Variable fee approach for direct-participation contracts. */
    VFA,
    /** Premium allocation approach for short coverage. */
    PAA
}
