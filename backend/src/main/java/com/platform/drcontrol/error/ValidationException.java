package com.platform.drcontrol.error;

/**
 * Exception for request validation errors.
 */
public class ValidationException extends ControlPlaneException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(String field, Object rejectedValue, String message) {
        this(ErrorCode.INVALID_FIELD_VALUE, field, rejectedValue, message);
    }
    
    public ValidationException(ErrorCode errorCode, String field, Object rejectedValue, String message) {
        super(errorCode, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public static ValidationException invalidRegion(String field, String value) {
        return new ValidationException(ErrorCode.INVALID_REGION, field, value,
            "expected a provider region name such as us-east-1");
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
