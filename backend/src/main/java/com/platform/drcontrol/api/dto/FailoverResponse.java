package com.platform.drcontrol.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.platform.drcontrol.model.FailoverOutcome;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FailoverResponse(
    String status,
    String message,
    String action,
    Instant timestamp
) {
    
    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";
    
    public static FailoverResponse from(FailoverOutcome outcome) {
        return new FailoverResponse(
            outcome.isSuccess() ? SUCCESS : FAILED,
            outcome.message(),
            outcome.action(),
            outcome.timestamp()
        );
    }
}
