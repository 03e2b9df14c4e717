package com.platform.drcontrol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Overall verdict of a validation run.
 */
public enum ValidationStatus {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    /**
     * Reserved. Scoring only ever yields HEALTHY or DEGRADED.
     */
    FAILED("failed");
    
    private final String wireName;
    
    ValidationStatus(String wireName) {
        this.wireName = wireName;
    }
    
    @JsonValue
    public String wireName() {
        return wireName;
    }
    
    @JsonCreator
    public static ValidationStatus fromWireName(String value) {
        return Arrays.stream(values())
            .filter(status -> status.wireName.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown validation status: " + value));
    }
}
