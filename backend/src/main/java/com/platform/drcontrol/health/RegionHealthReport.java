package com.platform.drcontrol.health;

import com.platform.drcontrol.model.Region;

import java.time.Instant;
import java.util.Optional;

/**
 * Per-region health snapshot: storage and blob storage reachability plus heartbeat age.
 */
public record RegionHealthReport(
    Region region,
    boolean storageHealthy,
    boolean blobStorageHealthy,
    Optional<Long> replicationLagSeconds,
    Instant timestamp
) {
    
    public boolean isHealthy() {
        return storageHealthy && blobStorageHealthy;
    }
}
