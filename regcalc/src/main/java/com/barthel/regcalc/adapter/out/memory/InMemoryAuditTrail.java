package com.barthel.regcalc.adapter.out.memory;

import com.barthel.regcalc.application.port.out.AppendAuditRecordPort;
import com.barthel.regcalc.domain.model.audit.AuditRecord;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Lock-free audit sink for embedded use and tests. Records keep append order.
 */
public class InMemoryAuditTrail implements AppendAuditRecordPort {

    private final Queue<AuditRecord> records = new ConcurrentLinkedQueue<>();

    @Override
    public void append(AuditRecord auditRecord) {
        records.add(auditRecord);
    }

    /**
     * @return a snapshot of the trail
     */
    public List<AuditRecord> records() {
        return List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
