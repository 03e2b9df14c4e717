package com.platform.drcontrol.persistence.entity;

import com.platform.drcontrol.model.BackupRecordStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for backup metadata, one row per backup written to blob storage.
 */
@Entity
@Table(name = "backup_metadata", indexes = {
    @Index(name = "idx_backup_table", columnList = "table_name"),
    @Index(name = "idx_backup_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupMetadataEntity {
    
    @Id
    @Column(name = "backup_id", length = 255)
    private String backupId;
    
    @Column(name = "table_name", nullable = false)
    private String tableName;
    
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
    
    @Column(name = "items_count", nullable = false)
    private long itemsCount;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "status", columnDefinition = "VARCHAR(20)", nullable = false)
    private BackupRecordStatus status;
}
