package com.platform.drcontrol.error;

/**
 * Exception for resources that do not exist (yet).
 */
public class ResourceNotFoundException extends ControlPlaneException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException failoverRecord(String recordId) {
        return new ResourceNotFoundException(ErrorCode.FAILOVER_RECORD_NOT_FOUND, "Failover record", recordId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
