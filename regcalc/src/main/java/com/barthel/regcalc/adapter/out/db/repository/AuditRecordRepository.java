package com.barthel.regcalc.adapter.out.db.repository;

import com.barthel.regcalc.adapter.out.db.entity.AuditRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditRecordRepository extends JpaRepository<AuditRecordEntity, Long> {
}
