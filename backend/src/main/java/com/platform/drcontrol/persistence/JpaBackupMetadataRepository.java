package com.platform.drcontrol.persistence;

import com.platform.drcontrol.backup.BackupMetadataRepository;
import com.platform.drcontrol.model.BackupRecord;
import com.platform.drcontrol.persistence.repository.BackupMetadataJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * JPA-backed backup metadata.
 */
@Component
@RequiredArgsConstructor
public class JpaBackupMetadataRepository implements BackupMetadataRepository {
    
    private final BackupMetadataJpaRepository jpaRepository;
    private final EntityMappers mappers;
    
    @Override
    @Transactional(readOnly = true)
    public List<BackupRecord> listBackupRecords() {
        return jpaRepository.findAll().stream()
            .map(mappers::toDomain)
            .toList();
    }
    
    @Override
    @Transactional
    public void save(BackupRecord record) {
        jpaRepository.save(mappers.toEntity(record));
    }
}
