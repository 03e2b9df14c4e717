package com.platform.drcontrol.model;

import java.util.Optional;

/**
 * Age of the newest and oldest completed backups. Ages are absent when no backups exist.
 */
public record BackupFreshness(
    Optional<Double> lastBackupAgeHours,
    long backupCount,
    Optional<Double> oldestBackupAgeDays
) {
    
    public BackupFreshness {
        lastBackupAgeHours = lastBackupAgeHours == null ? Optional.empty() : lastBackupAgeHours;
        oldestBackupAgeDays = oldestBackupAgeDays == null ? Optional.empty() : oldestBackupAgeDays;
    }
    
    public static BackupFreshness unknown() {
        return new BackupFreshness(Optional.empty(), 0, Optional.empty());
    }
}
