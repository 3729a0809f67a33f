package com.barthel.regcalc.domain.model.credit;

/**
 * A portfolio item that could not be measured.
 *
 * @param exposureId identifier of the failing exposure, or its position when it had none
 * @param message reason
 */
public record ExposureFailure(String exposureId, String message) {
}
