package com.platform.drcontrol.backup;

import com.platform.drcontrol.model.BackupRecord;

import java.util.List;

/**
 * Backup metadata records, one per backup run.
 */
public interface BackupMetadataRepository {
    
    List<BackupRecord> listBackupRecords();
    
    void save(BackupRecord record);
}
