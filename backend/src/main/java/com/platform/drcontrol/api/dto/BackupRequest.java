package com.platform.drcontrol.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BackupRequest(
    @NotBlank(message = "table_name is required")
    String tableName,
    String backupType
) {
}
