package com.platform.drcontrol.model;

import java.time.Instant;

/**
 * The latest region switch decision. Only one record exists at a time; each write replaces it.
 */
public record FailoverRecord(
    FailoverAction action,
    Region sourceRegion,
    Region targetRegion,
    FailoverRecordStatus status,
    Instant timestamp
) {
    
    /**
     * Logical key of the single failover record slot.
     */
    public static final String RECORD_ID = "failover_status";
    
    public static FailoverRecord completed(FailoverRequest request, Region sourceRegion, Instant timestamp) {
        return new FailoverRecord(request.action(), sourceRegion, request.targetRegion(),
            FailoverRecordStatus.COMPLETED, timestamp);
    }
    
    public static FailoverRecord rejected(FailoverRequest request, Region sourceRegion, Instant timestamp) {
        return new FailoverRecord(request.action(), sourceRegion, request.targetRegion(),
            FailoverRecordStatus.REJECTED, timestamp);
    }
}
