package com.platform.drcontrol.model;

public enum FailoverRecordStatus {
    COMPLETED,
    REJECTED
}
