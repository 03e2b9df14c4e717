package com.platform.drcontrol.model;

/**
 * Items that a sync run would reconcile. {@code performed} is always false: no data is copied.
 */
public record SyncSummary(long itemsPending, boolean performed) {
    
    public static SyncSummary pending(long itemsPending) {
        return new SyncSummary(itemsPending, false);
    }
}
