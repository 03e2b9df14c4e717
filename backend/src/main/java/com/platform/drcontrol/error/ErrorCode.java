package com.platform.drcontrol.error;

/**
 * Standardized error codes for the DR control plane.
 * 
 * Format: DR-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (not found)
 * - 4xx: Backend errors (regional storage, blob storage, metrics collector, database)
 * - 5xx: Domain errors (validation runs, failover, backups)
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("DR-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("DR-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("DR-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("DR-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    INVALID_REGION("DR-104", "Invalid region identifier", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("DR-300", "Resource not found", ErrorCategory.RECOVERABLE),
    FAILOVER_RECORD_NOT_FOUND("DR-301", "No failover has been recorded", ErrorCategory.RECOVERABLE),
    
    // ==================== Backend Errors (4xx) ====================
    
    BACKEND_UNAVAILABLE("DR-400", "Regional storage unavailable", ErrorCategory.RECOVERABLE),
    BLOB_STORAGE_UNAVAILABLE("DR-410", "Blob storage unavailable", ErrorCategory.RECOVERABLE),
    METRICS_COLLECTOR_UNAVAILABLE("DR-420", "Metrics collector unavailable", ErrorCategory.RECOVERABLE),
    DATABASE_ERROR("DR-430", "Database error", ErrorCategory.FATAL),
    
    // ==================== Domain Errors (5xx) ====================
    
    VALIDATION_RUN_FAILED("DR-500", "Consistency validation failed", ErrorCategory.RECOVERABLE),
    FAILOVER_RECORD_FAILED("DR-510", "Failover record could not be written", ErrorCategory.FATAL),
    BACKUP_FAILED("DR-520", "Backup failed", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    UNEXPECTED_ERROR("DR-901", "Unexpected error occurred", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("DR-903", "Serialization error", ErrorCategory.RECOVERABLE);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - system is in bad state, may require intervention.
         */
        FATAL
    }
}
