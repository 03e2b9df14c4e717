package com.platform.drcontrol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Scope requested for a validation run. Reported back unchanged in the response.
 */
public enum ValidationMode {
    FULL("full"),
    INCREMENTAL("incremental"),
    /**
     * Validate exactly the table named in the request.
     */
    SPECIFIC("specific");
    
    private final String wireName;
    
    ValidationMode(String wireName) {
        this.wireName = wireName;
    }
    
    @JsonValue
    public String wireName() {
        return wireName;
    }
    
    @JsonCreator
    public static ValidationMode fromWireName(String value) {
        return Arrays.stream(values())
            .filter(mode -> mode.wireName.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown validation mode: " + value));
    }
}
