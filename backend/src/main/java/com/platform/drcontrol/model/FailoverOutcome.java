package com.platform.drcontrol.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Result of one orchestrator invocation.
 * 
 * @param action the action exactly as requested (may be an unknown value)
 * @param record the record written by this invocation, if any
 */
public record FailoverOutcome(
    Status status,
    Reason reason,
    String message,
    String action,
    Instant timestamp,
    Optional<FailoverRecord> record
) {
    
    public enum Status {
        SUCCESS,
        FAILED
    }
    
    /**
     * Why an invocation ended the way it did; drives the HTTP status of the response.
     */
    public enum Reason {
        COMPLETED,
        MALFORMED_REQUEST,
        INVALID_ACTION,
        INVALID_REGION,
        TARGET_UNHEALTHY,
        RECORD_WRITE_FAILED
    }
    
    public static FailoverOutcome success(String message, FailoverRecord record) {
        return new FailoverOutcome(Status.SUCCESS, Reason.COMPLETED, message,
            record.action().wireName(), record.timestamp(), Optional.of(record));
    }
    
    public static FailoverOutcome failed(Reason reason, String message, String action, Instant timestamp) {
        return failed(reason, message, action, timestamp, Optional.empty());
    }
    
    public static FailoverOutcome failed(Reason reason, String message, String action, Instant timestamp,
                                         Optional<FailoverRecord> record) {
        return new FailoverOutcome(Status.FAILED, reason, message, action, timestamp, record);
    }
    
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
