package com.platform.drcontrol.model;

import java.time.Instant;

/**
 * Metadata of one table backup written to blob storage.
 */
public record BackupRecord(
    String backupId,
    String tableName,
    Instant timestamp,
    long itemsCount,
    BackupRecordStatus status
) {
    
    public boolean isCompleted() {
        return status == BackupRecordStatus.COMPLETED;
    }
}
