package com.platform.drcontrol.error;

/**
 * Raised when a regional backend (storage, blob storage, metrics collector) cannot serve a call.
 */
public class BackendUnavailableException extends ControlPlaneException {
    
    private final String region;
    private final String operation;
    
    public BackendUnavailableException(ErrorCode errorCode, String region, String operation,
                                       String message, Throwable cause) {
        super(errorCode, message, cause);
        this.region = region;
        this.operation = operation;
    }
    
    public static BackendUnavailableException storage(String region, String operation, Throwable cause) {
        return new BackendUnavailableException(
            ErrorCode.BACKEND_UNAVAILABLE,
            region,
            operation,
            String.format("Storage operation %s failed in %s: %s", operation, region, cause.getMessage()),
            cause
        );
    }
    
    public static BackendUnavailableException blobStorage(String region, String operation, Throwable cause) {
        return new BackendUnavailableException(
            ErrorCode.BLOB_STORAGE_UNAVAILABLE,
            region,
            operation,
            String.format("Blob storage operation %s failed in %s: %s", operation, region, cause.getMessage()),
            cause
        );
    }
    
    public static BackendUnavailableException metricsCollector(String region, String metricName, Throwable cause) {
        return new BackendUnavailableException(
            ErrorCode.METRICS_COLLECTOR_UNAVAILABLE,
            region,
            "publish:" + metricName,
            String.format("Failed to publish metric %s: %s", metricName, cause.getMessage()),
            cause
        );
    }
    
    public String getRegion() {
        return region;
    }
    
    public String getOperation() {
        return operation;
    }
}
