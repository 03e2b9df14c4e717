package com.platform.drcontrol.connectors;

import com.platform.drcontrol.model.Region;

/**
 * Region-addressed object storage used for table backups.
 */
public interface BlobStore {
    
    /**
     * Bounded listing of the bucket; throws if the bucket cannot be listed.
     */
    void ping(Region region, String bucket);
    
    void putJson(Region region, String bucket, String key, byte[] content);
}
