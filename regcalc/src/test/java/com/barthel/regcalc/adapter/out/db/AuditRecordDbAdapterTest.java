package com.barthel.regcalc.adapter.out.db;

import com.barthel.regcalc.adapter.out.db.entity.AuditRecordEntity;
import com.barthel.regcalc.adapter.out.db.repository.AuditRecordRepository;
import com.barthel.regcalc.domain.model.audit.AuditRecord;
import com.barthel.regcalc.domain.model.audit.RegulatoryReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AuditRecordDbAdapterTest {

    @Mock
    private AuditRecordRepository repository;

    @InjectMocks
    private AuditRecordDbAdapter adapter;

    @Test
    void mapsRecordOntoNewRow() {
        Instant timestamp = Instant.parse("2025-11-01T09:00:00Z");
        adapter.append(new AuditRecord(timestamp, "SCR calculation", "a".repeat(64), "b".repeat(64),
                RegulatoryReference.SOLVENCY_II_SCR));

        ArgumentCaptor<AuditRecordEntity> saved = ArgumentCaptor.forClass(AuditRecordEntity.class);
        verify(repository).save(saved.capture());
        AuditRecordEntity entity = saved.getValue();
        assertThat(entity.getId()).isNull();
        assertThat(entity.getRecordedAt()).isEqualTo(timestamp);
        assertThat(entity.getOperation()).isEqualTo("SCR calculation");
        assertThat(entity.getInputDigest()).isEqualTo("a".repeat(64));
        assertThat(entity.getResultDigest()).isEqualTo("b".repeat(64));
        assertThat(entity.getRegulatoryReference()).isEqualTo(RegulatoryReference.SOLVENCY_II_SCR);
    }
}
