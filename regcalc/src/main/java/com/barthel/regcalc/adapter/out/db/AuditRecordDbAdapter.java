package com.barthel.regcalc.adapter.out.db;

import com.barthel.regcalc.adapter.out.db.entity.AuditRecordEntity;
import com.barthel.regcalc.adapter.out.db.repository.AuditRecordRepository;
import com.barthel.regcalc.application.port.out.AppendAuditRecordPort;
import com.barthel.regcalc.domain.model.audit.AuditRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Persists audit records; rows are only ever inserted.
 */
@Component
@RequiredArgsConstructor
public class AuditRecordDbAdapter implements AppendAuditRecordPort {

    private final AuditRecordRepository repository;

    @Override
    public void append(AuditRecord auditRecord) {
        AuditRecordEntity entity = AuditRecordEntity.builder()
                .recordedAt(auditRecord.timestamp())
                .operation(auditRecord.operation())
                .inputDigest(auditRecord.inputDigest())
                .resultDigest(auditRecord.resultDigest())
                .regulatoryReference(auditRecord.regulatoryReference())
                .build();
        repository.save(entity);
    }
}
