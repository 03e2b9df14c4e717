package com.platform.drcontrol.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationResults(
    int tablesValidated,
    long recordsChecked,
    long mismatchesFound,
    Long replicationLagSeconds,
    BackupStatusDto backupStatus,
    double consistencyScore,
    SyncStatusDto syncStatus
) {
}
