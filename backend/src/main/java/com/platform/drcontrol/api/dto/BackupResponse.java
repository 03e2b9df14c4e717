package com.platform.drcontrol.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.platform.drcontrol.backup.BackupOutcome;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BackupResponse(
    String status,
    String backupId,
    Instant timestamp,
    long itemsBackedUp
) {
    
    public static BackupResponse from(BackupOutcome outcome) {
        return new BackupResponse("success", outcome.backupId(), outcome.timestamp(), outcome.itemsBackedUp());
    }
}
