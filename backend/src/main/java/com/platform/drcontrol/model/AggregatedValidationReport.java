package com.platform.drcontrol.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable result of one consistency validation run.
 */
@Builder
public record AggregatedValidationReport(
    ValidationStatus status,
    ValidationMode mode,
    Instant timestamp,
    int tablesValidated,
    long recordsChecked,
    long mismatchesFound,
    Optional<Long> replicationLagSeconds,
    BackupFreshness backup,
    double consistencyScore,
    List<String> recommendations,
    Optional<SyncSummary> sync
) {
    
    public AggregatedValidationReport {
        recommendations = List.copyOf(recommendations);
        replicationLagSeconds = replicationLagSeconds == null ? Optional.empty() : replicationLagSeconds;
        sync = sync == null ? Optional.empty() : sync;
        backup = backup == null ? BackupFreshness.unknown() : backup;
    }
}
