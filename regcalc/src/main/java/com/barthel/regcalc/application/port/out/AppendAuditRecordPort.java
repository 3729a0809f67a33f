package com.barthel.regcalc.application.port.out;

import com.barthel.regcalc.domain.model.audit.AuditRecord;

/**
 * Port for the append-only audit sink.
 */
public interface AppendAuditRecordPort {
    /**
     * Append the given record. Implementations must tolerate concurrent calls.
     *
     * @param auditRecord the record to append
     */
    void append(AuditRecord auditRecord);
}
