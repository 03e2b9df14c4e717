package com.platform.drcontrol.persistence.repository;

import com.platform.drcontrol.model.BackupRecordStatus;
import com.platform.drcontrol.persistence.entity.BackupMetadataEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for backup metadata.
 */
@Repository
public interface BackupMetadataJpaRepository extends JpaRepository<BackupMetadataEntity, String> {
    
    List<BackupMetadataEntity> findByStatus(BackupRecordStatus status);
    
    List<BackupMetadataEntity> findByTableNameOrderByCreatedAtDesc(String tableName);
}
