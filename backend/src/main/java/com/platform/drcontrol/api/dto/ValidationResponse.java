package com.platform.drcontrol.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.platform.drcontrol.model.AggregatedValidationReport;
import com.platform.drcontrol.model.ValidationMode;
import com.platform.drcontrol.model.ValidationStatus;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationResponse(
    ValidationStatus status,
    ValidationMode validationMode,
    Instant timestamp,
    ValidationResults results,
    List<String> recommendations
) {
    
    public static ValidationResponse from(AggregatedValidationReport report) {
        return new ValidationResponse(
            report.status(),
            report.mode(),
            report.timestamp(),
            new ValidationResults(
                report.tablesValidated(),
                report.recordsChecked(),
                report.mismatchesFound(),
                report.replicationLagSeconds().orElse(null),
                BackupStatusDto.from(report.backup()),
                report.consistencyScore(),
                report.sync().map(SyncStatusDto::from).orElse(null)
            ),
            report.recommendations()
        );
    }
}
