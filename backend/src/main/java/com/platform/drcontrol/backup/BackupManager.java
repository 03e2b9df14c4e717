package com.platform.drcontrol.backup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.connectors.BlobStore;
import com.platform.drcontrol.connectors.RegionalDataStore;
import com.platform.drcontrol.error.BackupFailedException;
import com.platform.drcontrol.model.BackupRecord;
import com.platform.drcontrol.model.BackupRecordStatus;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.model.TableIdentifier;
import com.platform.drcontrol.observability.LoggingConfig;
import com.platform.drcontrol.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Extracts a table from the current region into blob storage and records the backup.
 * 
 * The metadata record is written only after the upload succeeds, so a partial run
 * never counts towards backup freshness.
 */
@Slf4j
@Service
public class BackupManager {
    
    private final RegionalDataStore dataStore;
    private final BlobStore blobStore;
    private final BackupMetadataRepository metadataRepository;
    private final MetricsRegistry metricsRegistry;
    private final ObjectMapper objectMapper;
    private final DrControlProperties.Backup settings;
    private final Region region;
    private final Clock clock;
    
    public BackupManager(
            RegionalDataStore dataStore,
            BlobStore blobStore,
            BackupMetadataRepository metadataRepository,
            MetricsRegistry metricsRegistry,
            ObjectMapper objectMapper,
            DrControlProperties properties,
            Clock clock) {
        this.dataStore = dataStore;
        this.blobStore = blobStore;
        this.metadataRepository = metadataRepository;
        this.metricsRegistry = metricsRegistry;
        this.objectMapper = objectMapper;
        this.settings = properties.getBackup();
        this.region = Region.parse("drcontrol.current-region", properties.getCurrentRegion());
        this.clock = clock;
    }
    
    public BackupOutcome runBackup(TableIdentifier table, BackupType type) {
        Instant startedAt = Instant.now(clock);
        String backupId = backupId(table, type, startedAt);
        String objectKey = String.format("%s/%s/%s.json", settings.getKeyPrefix(), table.name(), backupId);
        
        LoggingConfig.setOperationContext("backup", table.name());
        try {
            log.info("Starting {} backup {} of {} in {}", type.wireName(), backupId, table, region);
            
            List<Map<String, Object>> items = dataStore.scanAll(region, table);
            blobStore.putJson(region, settings.getBucket(), objectKey, serialize(table, items));
            metadataRepository.save(new BackupRecord(backupId, table.name(), startedAt, items.size(),
                BackupRecordStatus.COMPLETED));
            
            log.info("Backup {} completed: {} items written to {}/{}", backupId, items.size(), settings.getBucket(), objectKey);
            metricsRegistry.recordBackup(table.name(), true, items.size());
            return new BackupOutcome(backupId, table.name(), objectKey, startedAt, items.size());
            
        } catch (BackupFailedException e) {
            metricsRegistry.recordBackup(table.name(), false, 0);
            throw e;
        } catch (RuntimeException e) {
            metricsRegistry.recordBackup(table.name(), false, 0);
            throw new BackupFailedException(table.name(),
                String.format("Backup %s of %s failed: %s", backupId, table, e.getMessage()), e);
        } finally {
            LoggingConfig.clearOperationContext();
        }
    }
    
    static String backupId(TableIdentifier table, BackupType type, Instant timestamp) {
        return String.format("%s-%s-%d", table.name(), type.wireName(), timestamp.getEpochSecond());
    }
    
    private byte[] serialize(TableIdentifier table, List<Map<String, Object>> items) {
        try {
            return objectMapper.writeValueAsBytes(items);
        } catch (JsonProcessingException e) {
            throw new BackupFailedException(table.name(), "Could not serialize items of " + table, e);
        }
    }
}
