package com.platform.drcontrol.model;

public enum BackupRecordStatus {
    COMPLETED,
    FAILED
}
