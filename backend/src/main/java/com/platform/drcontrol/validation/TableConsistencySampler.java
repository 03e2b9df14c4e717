package com.platform.drcontrol.validation;

import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.connectors.RegionalDataStore;
import com.platform.drcontrol.connectors.dynamodb.ItemKey;
import com.platform.drcontrol.error.BackendUnavailableException;
import com.platform.drcontrol.model.RegionPair;
import com.platform.drcontrol.model.TableIdentifier;
import com.platform.drcontrol.model.TableValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares one table across regions: approximate item counts plus a bounded existence sample.
 */
@Slf4j
@Component
public class TableConsistencySampler {
    
    private final RegionalDataStore dataStore;
    private final DrControlProperties.Validation settings;
    
    public TableConsistencySampler(RegionalDataStore dataStore, DrControlProperties properties) {
        this.dataStore = dataStore;
        this.settings = properties.getValidation();
    }
    
    /**
     * @throws BackendUnavailableException if either count query fails
     */
    public TableValidationResult sample(RegionPair regions, TableIdentifier table) {
        long primaryCount = dataStore.approximateItemCount(regions.primary(), table);
        long secondaryCount = dataStore.approximateItemCount(regions.secondary(), table);
        
        log.debug("Table {}: {} items in {}, {} in {}",
            table, primaryCount, regions.primary(), secondaryCount, regions.secondary());
        
        List<String> mismatches = sampleMismatches(regions, table);
        return new TableValidationResult(table, primaryCount, secondaryCount, mismatches);
    }
    
    private List<String> sampleMismatches(RegionPair regions, TableIdentifier table) {
        List<ItemKey> keys;
        try {
            keys = dataStore.sampleKeys(regions.primary(), table, settings.getKeyAttribute(), settings.getSampleSize());
        } catch (RuntimeException e) {
            log.warn("Could not sample {} in {}, continuing with counts only: {}",
                table, regions.primary(), e.getMessage());
            return List.of();
        }
        
        List<String> mismatches = new ArrayList<>();
        for (ItemKey key : keys) {
            if (mismatches.size() >= settings.getMaxSampleMismatches()) {
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.info("Sampling of {} abandoned after {} mismatches", table, mismatches.size());
                break;
            }
            try {
                if (!dataStore.itemExists(regions.secondary(), table, key)) {
                    mismatches.add(String.format("Item %s not found in %s", key, regions.secondary()));
                }
            } catch (RuntimeException e) {
                log.warn("Lookup of {} in {} ({}) failed: {}", key, table, regions.secondary(), e.getMessage());
                mismatches.add(String.format("Item %s lookup failed in %s", key, regions.secondary()));
            }
        }
        return mismatches;
    }
}
