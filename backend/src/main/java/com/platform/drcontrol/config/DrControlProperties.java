package com.platform.drcontrol.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the DR control plane.
 */
@Data
@ConfigurationProperties(prefix = "drcontrol")
public class DrControlProperties {
    
    /**
     * Region this control plane runs in; recorded as the source of every failover.
     */
    private String currentRegion = "us-east-1";
    
    /**
     * Primary region used when a validation request names none.
     */
    private String defaultSourceRegion = "us-east-1";
    
    /**
     * Secondary region used when a validation request names none.
     */
    private String defaultTargetRegion = "us-west-2";
    
    private Thresholds thresholds = new Thresholds();
    
    private Validation validation = new Validation();
    
    private Sentinel sentinel = new Sentinel();
    
    private Probe probe = new Probe();
    
    private Failover failover = new Failover();
    
    private Metrics metrics = new Metrics();
    
    private Backup backup = new Backup();
    
    private Aws aws = new Aws();
    
    /**
     * Recommendation and status thresholds.
     */
    @Data
    public static class Thresholds {
        /**
         * Minimum consistency score (percent) for a HEALTHY verdict.
         */
        private double minConsistencyScore = 95.0;
        
        private long maxReplicationLagSeconds = 60;
        
        private double maxBackupAgeHours = 24.0;
        
        private double maxBackupRetentionDays = 30.0;
    }
    
    @Data
    public static class Validation {
        /**
         * Tables validated when the request does not name one.
         */
        private List<String> defaultTables = new ArrayList<>(List.of("dr-application-table", "dr-sentinel-table"));
        
        /**
         * Partition key attribute used for existence lookups.
         */
        private String keyAttribute = "id";
        
        private int sampleSize = 10;
        
        private int maxSampleMismatches = 10;
        
        /**
         * Upper bound for sampling a single table (both count queries plus lookups).
         */
        private Duration tableTimeout = Duration.ofSeconds(30);
        
        /**
         * Worker threads shared by concurrent table samples and the lag probe.
         */
        private int workerThreads = 8;
    }
    
    @Data
    public static class Sentinel {
        private String table = "dr-sentinel-table";
        
        /**
         * Well-known record refreshed by the replication heartbeat, read by regional health checks.
         */
        private String recordId = "sentinel";
        
        private String heartbeatAttribute = "last_updated";
        
        private Duration pollInterval = Duration.ofSeconds(1);
        
        private int maxAttempts = 10;
        
        /**
         * Added to pollInterval x maxAttempts when bounding the whole lag measurement.
         */
        private Duration timeoutSlack = Duration.ofSeconds(5);
        
        public Duration maxMeasurementTime() {
            return pollInterval.multipliedBy(maxAttempts).plus(timeoutSlack);
        }
    }
    
    @Data
    public static class Probe {
        private Duration timeout = Duration.ofSeconds(3);
    }
    
    @Data
    public static class Failover {
        /**
         * When true, health-rejected attempts overwrite the record slot with a REJECTED record.
         */
        private boolean recordRejectedAttempts = false;
    }
    
    @Data
    public static class Metrics {
        private String namespace = "DisasterRecovery";
    }
    
    @Data
    public static class Backup {
        /**
         * Bucket receiving table backups from the current region.
         */
        private String bucket = "dr-demo-backup-bucket-primary";
        
        /**
         * Per-region backup buckets checked by regional health reports.
         */
        private Map<String, String> regionBuckets = new HashMap<>();
        
        private String keyPrefix = "backups";
        
        public String bucketFor(String region) {
            return regionBuckets.getOrDefault(region, "dr-demo-backup-bucket-" + region);
        }
    }
    
    @Data
    public static class Aws {
        /**
         * Optional endpoint override (e.g. LocalStack) applied to every regional client.
         */
        private String endpointOverride;
        
        private Duration apiCallTimeout = Duration.ofSeconds(10);
        
        private Duration apiCallAttemptTimeout = Duration.ofSeconds(3);
    }
}
