package com.platform.drcontrol.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.platform.drcontrol.model.SyncSummary;

/**
 * Outstanding items for a sync request. {@code performed} is always false: no data is copied.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SyncStatusDto(
    long itemsPending,
    boolean performed,
    String message
) {
    
    public static SyncStatusDto from(SyncSummary summary) {
        return new SyncStatusDto(
            summary.itemsPending(),
            summary.performed(),
            String.format("%d item(s) pending reconciliation; sync was not performed", summary.itemsPending())
        );
    }
}
