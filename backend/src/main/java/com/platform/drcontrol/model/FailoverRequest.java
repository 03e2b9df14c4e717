package com.platform.drcontrol.model;

import java.util.Objects;

/**
 * Validated failover or failback command.
 */
public record FailoverRequest(FailoverAction action, Region targetRegion, boolean force) {
    
    public FailoverRequest {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(targetRegion, "targetRegion");
    }
}
