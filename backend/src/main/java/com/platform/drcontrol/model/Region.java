package com.platform.drcontrol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.drcontrol.error.ValidationException;

import java.util.regex.Pattern;

/**
 * Provider region identifier (e.g. {@code us-east-1}).
 * Validated on construction; immutable.
 */
public record Region(String id) {
    
    private static final Pattern REGION_PATTERN = Pattern.compile("^[a-z]{2}(-[a-z]+)+-\\d{1,2}$");
    
    public Region {
        if (!isValid(id)) {
            throw ValidationException.invalidRegion("region", id);
        }
    }
    
    @JsonCreator
    public static Region of(String id) {
        return new Region(id);
    }
    
    /**
     * Parse a region for a named request field so validation errors point at the right field.
     */
    public static Region parse(String field, String value) {
        if (!isValid(value)) {
            throw ValidationException.invalidRegion(field, value);
        }
        return new Region(value);
    }
    
    public static boolean isValid(String id) {
        return id != null && REGION_PATTERN.matcher(id).matches();
    }
    
    @JsonValue
    public String id() {
        return id;
    }
    
    @Override
    public String toString() {
        return id;
    }
}
