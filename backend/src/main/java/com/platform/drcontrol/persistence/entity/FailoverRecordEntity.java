package com.platform.drcontrol.persistence.entity;

import com.platform.drcontrol.model.FailoverAction;
import com.platform.drcontrol.model.FailoverRecordStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the single current failover record.
 * The table holds at most one row, keyed by a fixed record id.
 */
@Entity
@Table(name = "failover_records")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailoverRecordEntity {
    
    @Id
    @Column(length = 64)
    private String id;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "action", columnDefinition = "VARCHAR(20)", nullable = false)
    private FailoverAction action;
    
    @Column(name = "source_region", length = 32, nullable = false)
    private String sourceRegion;
    
    @Column(name = "target_region", length = 32, nullable = false)
    private String targetRegion;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "status", columnDefinition = "VARCHAR(20)", nullable = false)
    private FailoverRecordStatus status;
    
    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
