package com.platform.drcontrol.persistence;

import com.platform.drcontrol.model.BackupRecord;
import com.platform.drcontrol.model.FailoverRecord;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.persistence.entity.BackupMetadataEntity;
import com.platform.drcontrol.persistence.entity.FailoverRecordEntity;
import org.springframework.stereotype.Component;

/**
 * Bidirectional mappers between domain records and JPA entities.
 */
@Component
public class EntityMappers {
    
    // ==================== FailoverRecord ====================
    
    public FailoverRecordEntity toEntity(FailoverRecord domain) {
        return FailoverRecordEntity.builder()
            .id(FailoverRecord.RECORD_ID)
            .action(domain.action())
            .sourceRegion(domain.sourceRegion().id())
            .targetRegion(domain.targetRegion().id())
            .status(domain.status())
            .recordedAt(domain.timestamp())
            .build();
    }
    
    public FailoverRecord toDomain(FailoverRecordEntity entity) {
        return new FailoverRecord(
            entity.getAction(),
            Region.of(entity.getSourceRegion()),
            Region.of(entity.getTargetRegion()),
            entity.getStatus(),
            entity.getRecordedAt()
        );
    }
    
    // ==================== BackupRecord ====================
    
    public BackupMetadataEntity toEntity(BackupRecord domain) {
        return BackupMetadataEntity.builder()
            .backupId(domain.backupId())
            .tableName(domain.tableName())
            .createdAt(domain.timestamp())
            .itemsCount(domain.itemsCount())
            .status(domain.status())
            .build();
    }
    
    public BackupRecord toDomain(BackupMetadataEntity entity) {
        return new BackupRecord(
            entity.getBackupId(),
            entity.getTableName(),
            entity.getCreatedAt(),
            entity.getItemsCount(),
            entity.getStatus()
        );
    }
}
