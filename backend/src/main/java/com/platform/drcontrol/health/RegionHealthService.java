package com.platform.drcontrol.health;

import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.connectors.BlobStore;
import com.platform.drcontrol.connectors.RegionalDataStore;
import com.platform.drcontrol.connectors.dynamodb.ItemKey;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.model.TableIdentifier;
import com.platform.drcontrol.probe.RegionHealthProbe;
import com.platform.drcontrol.reporting.MetricUnit;
import com.platform.drcontrol.reporting.MetricsReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Builds a region health report and publishes it as metrics.
 * 
 * Heartbeat age comes from the well-known sentinel record's last-updated epoch seconds,
 * which an external writer refreshes in the primary and replication carries to each region.
 */
@Slf4j
@Service
public class RegionHealthService {
    
    private final RegionHealthProbe healthProbe;
    private final BlobStore blobStore;
    private final RegionalDataStore dataStore;
    private final MetricsReporter metricsReporter;
    private final DrControlProperties properties;
    private final Clock clock;
    
    public RegionHealthService(
            RegionHealthProbe healthProbe,
            BlobStore blobStore,
            RegionalDataStore dataStore,
            MetricsReporter metricsReporter,
            DrControlProperties properties,
            Clock clock) {
        this.healthProbe = healthProbe;
        this.blobStore = blobStore;
        this.dataStore = dataStore;
        this.metricsReporter = metricsReporter;
        this.properties = properties;
        this.clock = clock;
    }
    
    public RegionHealthReport check(Region region) {
        boolean storageHealthy = healthProbe.probe(region);
        boolean blobStorageHealthy = blobStorageReachable(region);
        Optional<Long> lag = heartbeatAge(region);
        
        RegionHealthReport report = new RegionHealthReport(region, storageHealthy, blobStorageHealthy, lag,
            Instant.now(clock));
        
        metricsReporter.publish(MetricsReporter.STORAGE_HEALTH, storageHealthy ? 1 : 0, MetricUnit.COUNT);
        metricsReporter.publish(MetricsReporter.BLOB_STORAGE_HEALTH, blobStorageHealthy ? 1 : 0, MetricUnit.COUNT);
        lag.ifPresent(seconds -> metricsReporter.publish(MetricsReporter.REPLICATION_LAG, seconds, MetricUnit.SECONDS));
        
        log.info("Region {} health: storage={}, blob={}, heartbeat age={}",
            region, storageHealthy, blobStorageHealthy, lag.map(s -> s + "s").orElse("unknown"));
        return report;
    }
    
    private boolean blobStorageReachable(Region region) {
        String bucket = properties.getBackup().bucketFor(region.id());
        try {
            blobStore.ping(region, bucket);
            return true;
        } catch (RuntimeException e) {
            log.warn("Blob storage check for {} ({}) failed: {}", region, bucket, e.getMessage());
            return false;
        }
    }
    
    private Optional<Long> heartbeatAge(Region region) {
        DrControlProperties.Sentinel sentinel = properties.getSentinel();
        ItemKey key = ItemKey.string(properties.getValidation().getKeyAttribute(), sentinel.getRecordId());
        try {
            return dataStore.readAttribute(region, TableIdentifier.of(sentinel.getTable()), key,
                    sentinel.getHeartbeatAttribute())
                .flatMap(RegionHealthService::parseEpochSeconds)
                .map(updated -> Math.max(0L, Instant.now(clock).getEpochSecond() - updated));
        } catch (RuntimeException e) {
            log.warn("Could not read heartbeat in {}: {}", region, e.getMessage());
            return Optional.empty();
        }
    }
    
    private static Optional<Long> parseEpochSeconds(String value) {
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.debug("Heartbeat value '{}' is not epoch seconds", value);
            return Optional.empty();
        }
    }
}
