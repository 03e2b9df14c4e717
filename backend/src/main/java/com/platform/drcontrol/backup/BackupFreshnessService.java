package com.platform.drcontrol.backup;

import com.platform.drcontrol.model.BackupFreshness;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Reads backup metadata and summarises its freshness.
 * A metadata read failure yields an all-absent result instead of an error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupFreshnessService {
    
    private final BackupMetadataRepository metadataRepository;
    private final Clock clock;
    
    public BackupFreshness currentFreshness() {
        try {
            return BackupFreshnessCalculator.calculate(metadataRepository.listBackupRecords(), Instant.now(clock));
        } catch (RuntimeException e) {
            log.warn("Backup metadata unavailable, reporting unknown freshness: {}", e.getMessage());
            return BackupFreshness.unknown();
        }
    }
}
