package com.platform.drcontrol.error;

/**
 * A backup run could not complete.
 */
public class BackupFailedException extends ControlPlaneException {
    
    private final String tableName;
    
    public BackupFailedException(String tableName, String message, Throwable cause) {
        super(ErrorCode.BACKUP_FAILED, message, cause);
        this.tableName = tableName;
    }
    
    public String getTableName() {
        return tableName;
    }
}
