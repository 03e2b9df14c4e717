package com.platform.drcontrol.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.platform.drcontrol.health.RegionHealthReport;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegionHealthResponse(
    String region,
    String status,
    Map<String, Boolean> checks,
    Long replicationLagSeconds,
    Instant timestamp
) {
    
    public static RegionHealthResponse from(RegionHealthReport report) {
        return new RegionHealthResponse(
            report.region().id(),
            report.isHealthy() ? "healthy" : "unhealthy",
            Map.of(
                "storage", report.storageHealthy(),
                "blob_storage", report.blobStorageHealthy()
            ),
            report.replicationLagSeconds().orElse(null),
            report.timestamp()
        );
    }
}
