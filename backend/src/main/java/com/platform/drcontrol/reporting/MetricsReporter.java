package com.platform.drcontrol.reporting;

import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.model.AggregatedValidationReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Fire-and-forget publisher of DR signals to the external metrics collector.
 * 
 * Every failure is caught and logged per metric; callers never see an exception.
 */
@Slf4j
@Component
public class MetricsReporter {
    
    public static final String CONSISTENCY_SCORE = "ValidationConsistencyScore";
    public static final String MISMATCHES = "ValidationMismatches";
    public static final String STORAGE_HEALTH = "DynamoDBHealth";
    public static final String BLOB_STORAGE_HEALTH = "S3Health";
    public static final String REPLICATION_LAG = "ReplicationLag";
    
    private final MetricsCollectorClient collector;
    private final String namespace;
    private final Clock clock;
    
    public MetricsReporter(MetricsCollectorClient collector, DrControlProperties properties, Clock clock) {
        this.collector = collector;
        this.namespace = properties.getMetrics().getNamespace();
        this.clock = clock;
    }
    
    /**
     * Publish one metric. Returns whether the collector accepted it.
     */
    public boolean publish(String metricName, double value, MetricUnit unit) {
        try {
            collector.send(new MetricDatum(namespace, metricName, value, unit, Instant.now(clock)));
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to publish metric {}={} ({}): {}", metricName, value, unit, e.getMessage());
            return false;
        }
    }
    
    /**
     * Publish the score and mismatch count of a finished validation run.
     */
    public void publishValidation(AggregatedValidationReport report) {
        publish(CONSISTENCY_SCORE, report.consistencyScore(), MetricUnit.PERCENT);
        publish(MISMATCHES, report.mismatchesFound(), MetricUnit.COUNT);
    }
}
