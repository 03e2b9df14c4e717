package com.platform.drcontrol.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Raw failover request. Action and region stay strings so bad values become a
 * structured "failed" response instead of an unreadable body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FailoverRequestDto(
    String action,
    String targetRegion,
    Boolean force
) {
    
    public boolean forceOrDefault() {
        return Boolean.TRUE.equals(force);
    }
}
