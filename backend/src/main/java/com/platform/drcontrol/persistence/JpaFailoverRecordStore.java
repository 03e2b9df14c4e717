package com.platform.drcontrol.persistence;

import com.platform.drcontrol.failover.FailoverRecordStore;
import com.platform.drcontrol.model.FailoverRecord;
import com.platform.drcontrol.persistence.repository.FailoverRecordJpaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * JPA-backed failover record slot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaFailoverRecordStore implements FailoverRecordStore {
    
    private final FailoverRecordJpaRepository jpaRepository;
    private final EntityMappers mappers;
    
    @Override
    @Transactional
    public void save(FailoverRecord record) {
        jpaRepository.save(mappers.toEntity(record));
        log.debug("Stored failover record: {} -> {} ({})",
            record.sourceRegion(), record.targetRegion(), record.status());
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<FailoverRecord> current() {
        return jpaRepository.findById(FailoverRecord.RECORD_ID).map(mappers::toDomain);
    }
}
