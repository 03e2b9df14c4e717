package com.platform.drcontrol.backup;

import com.platform.drcontrol.model.BackupFreshness;
import com.platform.drcontrol.model.BackupRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Derives backup freshness from metadata records. Only completed backups count.
 */
public final class BackupFreshnessCalculator {
    
    private static final double SECONDS_PER_HOUR = 3600.0;
    private static final double SECONDS_PER_DAY = 86400.0;
    
    private BackupFreshnessCalculator() {
    }
    
    public static BackupFreshness calculate(Collection<BackupRecord> records, Instant now) {
        List<Instant> completed = records.stream()
            .filter(BackupRecord::isCompleted)
            .map(BackupRecord::timestamp)
            .sorted(Comparator.reverseOrder())
            .toList();
        
        if (completed.isEmpty()) {
            return BackupFreshness.unknown();
        }
        
        Instant newest = completed.get(0);
        Instant oldest = completed.get(completed.size() - 1);
        
        return new BackupFreshness(
            Optional.of(ageSeconds(newest, now) / SECONDS_PER_HOUR),
            completed.size(),
            Optional.of(ageSeconds(oldest, now) / SECONDS_PER_DAY)
        );
    }
    
    private static double ageSeconds(Instant timestamp, Instant now) {
        // Clock skew between writer and reader can put a backup slightly in the future
        return Math.max(0L, Duration.between(timestamp, now).toMillis()) / 1000.0;
    }
}
