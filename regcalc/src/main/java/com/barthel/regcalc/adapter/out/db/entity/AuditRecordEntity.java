package com.barthel.regcalc.adapter.out.db.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "audit_records")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Instant recordedAt;

    @Column(nullable = false, length = 64)
    private String operation;

    @Column(nullable = false, length = 64)
    private String inputDigest;

    @Column(nullable = false, length = 64)
    private String resultDigest;

    private String regulatoryReference;
}
