package com.platform.drcontrol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.drcontrol.error.ValidationException;

/**
 * Logical table name, identical in both regions.
 */
public record TableIdentifier(String name) {
    
    public TableIdentifier {
        if (name == null || name.isBlank()) {
            throw new ValidationException("table_name", name, "table name must not be blank");
        }
    }
    
    @JsonCreator
    public static TableIdentifier of(String name) {
        return new TableIdentifier(name);
    }
    
    @JsonValue
    public String name() {
        return name;
    }
    
    @Override
    public String toString() {
        return name;
    }
}
