package com.platform.drcontrol.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.platform.drcontrol.model.ValidationAction;
import com.platform.drcontrol.model.ValidationMode;

/**
 * Validation request. Every field is optional; defaults are applied by the controller.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationRequest(
    ValidationMode validationMode,
    String tableName,
    String sourceRegion,
    String targetRegion,
    ValidationAction action
) {
    
    public static ValidationRequest defaults() {
        return new ValidationRequest(null, null, null, null, null);
    }
}
