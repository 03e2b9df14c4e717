package com.platform.drcontrol.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.platform.drcontrol.model.BackupFreshness;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BackupStatusDto(
    Double lastBackupAgeHours,
    long backupCount,
    Double oldestBackupDays
) {
    
    public static BackupStatusDto from(BackupFreshness freshness) {
        return new BackupStatusDto(
            freshness.lastBackupAgeHours().orElse(null),
            freshness.backupCount(),
            freshness.oldestBackupAgeDays().orElse(null)
        );
    }
}
