package com.platform.drcontrol.connectors;

import com.platform.drcontrol.connectors.dynamodb.ItemKey;
import com.platform.drcontrol.error.BackendUnavailableException;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.model.TableIdentifier;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Region-addressed access to the replicated dataset.
 * 
 * Every method either succeeds or throws {@link BackendUnavailableException};
 * provider exceptions never escape an implementation.
 */
public interface RegionalDataStore {
    
    /**
     * Minimal side-effect-free call proving the region's storage endpoint answers.
     */
    void ping(Region region);
    
    /**
     * Provider-maintained approximate item count. Cheap, may lag behind writes.
     */
    long approximateItemCount(Region region, TableIdentifier table);
    
    /**
     * Up to {@code limit} item keys read from the start of the table.
     */
    List<ItemKey> sampleKeys(Region region, TableIdentifier table, String keyAttribute, int limit);
    
    boolean itemExists(Region region, TableIdentifier table, ItemKey key);
    
    /**
     * Write a flat string-attributed item. The key attribute must be part of {@code attributes}.
     */
    void putItem(Region region, TableIdentifier table, Map<String, String> attributes);
    
    void deleteItem(Region region, TableIdentifier table, ItemKey key);
    
    /**
     * Read one attribute of one item, in its string form.
     */
    Optional<String> readAttribute(Region region, TableIdentifier table, ItemKey key, String attribute);
    
    /**
     * Read the whole table, following pagination, as plain Java values.
     */
    List<Map<String, Object>> scanAll(Region region, TableIdentifier table);
}
