package com.platform.drcontrol.backup;

import com.platform.drcontrol.error.ValidationException;

import java.util.Arrays;

/**
 * Backup flavour. Both currently extract the whole table; the type is recorded in the backup id.
 */
public enum BackupType {
    FULL("full"),
    INCREMENTAL("incremental");
    
    private final String wireName;
    
    BackupType(String wireName) {
        this.wireName = wireName;
    }
    
    public String wireName() {
        return wireName;
    }
    
    public static BackupType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return FULL;
        }
        return Arrays.stream(values())
            .filter(type -> type.wireName.equals(value))
            .findFirst()
            .orElseThrow(() -> new ValidationException("backup_type", value, "expected full or incremental"));
    }
}
