package com.platform.drcontrol.failover;

import com.platform.drcontrol.model.FailoverRecord;

import java.util.Optional;

/**
 * Durable single-slot store for the latest failover record.
 * Each save replaces the previous record (last writer wins).
 */
public interface FailoverRecordStore {
    
    void save(FailoverRecord record);
    
    Optional<FailoverRecord> current();
}
