package com.platform.drcontrol.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Region switch direction. Both run the same health-gated algorithm.
 */
public enum FailoverAction {
    FAILOVER("failover", "Failover"),
    FAILBACK("failback", "Failback");
    
    private final String wireName;
    private final String displayName;
    
    FailoverAction(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }
    
    public String wireName() {
        return wireName;
    }
    
    public String displayName() {
        return displayName;
    }
    
    /**
     * Lenient lookup used at the request boundary; unknown actions are rejected, not thrown.
     */
    public static Optional<FailoverAction> fromWireName(String value) {
        return Arrays.stream(values())
            .filter(action -> action.wireName.equals(value))
            .findFirst();
    }
}
