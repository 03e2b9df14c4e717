package com.platform.drcontrol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * What a validation run does with mismatching tables.
 */
public enum ValidationAction {
    VALIDATE("validate"),
    /**
     * Additionally report how many items would be reconciled. No data is copied.
     */
    SYNC("sync");
    
    private final String wireName;
    
    ValidationAction(String wireName) {
        this.wireName = wireName;
    }
    
    @JsonValue
    public String wireName() {
        return wireName;
    }
    
    @JsonCreator
    public static ValidationAction fromWireName(String value) {
        return Arrays.stream(values())
            .filter(action -> action.wireName.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown validation action: " + value));
    }
}
