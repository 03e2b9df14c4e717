package com.platform.drcontrol.validation;

import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.connectors.RegionalDataStore;
import com.platform.drcontrol.connectors.dynamodb.ItemKey;
import com.platform.drcontrol.model.RegionPair;
import com.platform.drcontrol.model.TableIdentifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Measures replication lag by writing a throwaway marker to the primary and polling the secondary.
 * 
 * Blocks for at most poll-interval x max-attempts. A marker that never shows up yields no signal,
 * not an error. The marker is always removed from the primary afterwards on a best-effort basis.
 */
@Slf4j
@Component
public class SentinelReplicationProber {
    
    static final String MARKER_PREFIX = "lag-test-";
    
    private final RegionalDataStore dataStore;
    private final DrControlProperties.Sentinel settings;
    private final String keyAttribute;
    private final Clock clock;
    
    public SentinelReplicationProber(RegionalDataStore dataStore, DrControlProperties properties, Clock clock) {
        this.dataStore = dataStore;
        this.settings = properties.getSentinel();
        this.keyAttribute = properties.getValidation().getKeyAttribute();
        this.clock = clock;
    }
    
    /**
     * @return whole seconds from marker write to first visibility in the secondary, or empty
     */
    public Optional<Long> measureLag(RegionPair regions) {
        TableIdentifier table = TableIdentifier.of(settings.getTable());
        ItemKey marker = ItemKey.string(keyAttribute, newMarkerId());
        
        Instant writtenAt = Instant.now(clock);
        try {
            dataStore.putItem(regions.primary(), table, Map.of(
                keyAttribute, marker.value(),
                "timestamp", writtenAt.toString(),
                "source", regions.primary().id()
            ));
        } catch (RuntimeException e) {
            log.warn("Could not write replication marker to {} in {}: {}", table, regions.primary(), e.getMessage());
            return Optional.empty();
        }
        
        try {
            return pollSecondary(regions, table, marker, writtenAt);
        } finally {
            deleteMarker(regions, table, marker);
        }
    }
    
    private Optional<Long> pollSecondary(RegionPair regions, TableIdentifier table, ItemKey marker, Instant writtenAt) {
        Duration interval = settings.getPollInterval();
        for (int attempt = 1; attempt <= settings.getMaxAttempts(); attempt++) {
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Replication lag measurement interrupted after {} attempts", attempt - 1);
                return Optional.empty();
            }
            
            try {
                if (dataStore.itemExists(regions.secondary(), table, marker)) {
                    long lagSeconds = Duration.between(writtenAt, Instant.now(clock)).getSeconds();
                    log.info("Replication marker {} visible in {} after {}s (attempt {})",
                        marker, regions.secondary(), lagSeconds, attempt);
                    return Optional.of(Math.max(0L, lagSeconds));
                }
            } catch (RuntimeException e) {
                log.debug("Marker lookup in {} failed on attempt {}: {}", regions.secondary(), attempt, e.getMessage());
            }
        }
        
        log.warn("Replication marker {} not visible in {} after {} attempts",
            marker, regions.secondary(), settings.getMaxAttempts());
        return Optional.empty();
    }
    
    private void deleteMarker(RegionPair regions, TableIdentifier table, ItemKey marker) {
        try {
            dataStore.deleteItem(regions.primary(), table, marker);
        } catch (RuntimeException e) {
            log.warn("Failed to delete replication marker {} from {}: {}", marker, regions.primary(), e.getMessage());
        }
    }
    
    private String newMarkerId() {
        return MARKER_PREFIX + Instant.now(clock).toEpochMilli() + "-"
            + Integer.toHexString(ThreadLocalRandom.current().nextInt(0x10000));
    }
}
