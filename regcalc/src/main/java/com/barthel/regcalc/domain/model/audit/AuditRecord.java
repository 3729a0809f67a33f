package com.barthel.regcalc.domain.model.audit;

import java.time.Instant;

/**
 * Immutable entry of the audit trail, one per engine invocation.
 *
 * @param timestamp time the record was appended
 * @param operation engine operation name
 * @param inputDigest SHA-256 of the canonical input
 * @param resultDigest SHA-256 of the canonical result
 * @param regulatoryReference standard the calculation follows
 */
public record AuditRecord(
        Instant timestamp,
        String operation,
        String inputDigest,
        String resultDigest,
        String regulatoryReference) {
}
