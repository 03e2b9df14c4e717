package com.platform.drcontrol.backup;

import java.time.Instant;

/**
 * Result of a completed backup run.
 */
public record BackupOutcome(
    String backupId,
    String tableName,
    String objectKey,
    Instant timestamp,
    long itemsBackedUp
) {
}
