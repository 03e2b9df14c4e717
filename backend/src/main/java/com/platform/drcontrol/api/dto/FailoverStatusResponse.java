package com.platform.drcontrol.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.platform.drcontrol.model.FailoverRecord;

import java.time.Instant;
import java.util.Locale;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FailoverStatusResponse(
    String id,
    String action,
    String sourceRegion,
    String targetRegion,
    String status,
    Instant timestamp
) {
    
    public static FailoverStatusResponse from(FailoverRecord record) {
        return new FailoverStatusResponse(
            FailoverRecord.RECORD_ID,
            record.action().wireName(),
            record.sourceRegion().id(),
            record.targetRegion().id(),
            record.status().name().toLowerCase(Locale.ROOT),
            record.timestamp()
        );
    }
}
