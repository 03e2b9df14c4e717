package com.platform.drcontrol.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Central registry for the control plane's own operational metrics.
 * Independent of the external metrics collector that receives DR signals.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, AtomicInteger> regionHealth;
    // Score scaled by 100 so the gauge can be backed by an AtomicLong
    private final AtomicLong lastConsistencyScore;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.regionHealth = new ConcurrentHashMap<>();
        this.lastConsistencyScore = new AtomicLong(-1);
        
        Gauge.builder("drcontrol.validation.consistency_score",
                () -> lastConsistencyScore.get() < 0 ? Double.NaN : lastConsistencyScore.get() / 100.0)
            .register(meterRegistry);
        
        log.info("Metrics registry initialized");
    }
    
    // ==================== Validation ====================
    
    /**
     * Record a finished validation run.
     */
    public void recordValidationRun(String status, double consistencyScore, long durationMs) {
        incrementCounter("drcontrol.validation.runs", "status", status);
        lastConsistencyScore.set(Math.round(consistencyScore * 100));
        recordLatency("validation", "run", durationMs);
    }
    
    public void recordTableSampleFailure(String table) {
        incrementCounter("drcontrol.validation.table_failures", "table", table);
    }
    
    public void recordLagMeasurement(boolean observed) {
        incrementCounter("drcontrol.validation.lag_probe", "observed", String.valueOf(observed));
    }
    
    // ==================== Failover ====================
    
    public void recordFailoverRequest(String action, String outcome) {
        incrementCounter("drcontrol.failover.requests", "action", action, "outcome", outcome);
    }
    
    // ==================== Regions ====================
    
    /**
     * Record a probe result and expose it as a per-region gauge (1 healthy, 0 not).
     */
    public void recordProbeResult(String region, boolean healthy) {
        incrementCounter("drcontrol.probe.results", "region", region, "healthy", String.valueOf(healthy));
        regionHealth.computeIfAbsent(region, r -> {
            AtomicInteger value = new AtomicInteger(0);
            Gauge.builder("drcontrol.region.health", value, AtomicInteger::get)
                .tag("region", r)
                .register(meterRegistry);
            return value;
        }).set(healthy ? 1 : 0);
    }
    
    public int getRegionHealth(String region) {
        AtomicInteger status = regionHealth.get(region);
        return status != null ? status.get() : -1;
    }
    
    // ==================== Backups ====================
    
    public void recordBackup(String table, boolean success, long items) {
        incrementCounter("drcontrol.backups", "table", table, "success", String.valueOf(success));
        if (success) {
            counters.computeIfAbsent("drcontrol.backups.items." + table, k ->
                Counter.builder("drcontrol.backups.items")
                    .tag("table", table)
                    .register(meterRegistry))
                .increment(items);
        }
    }
    
    // ==================== Generic ====================
    
    /**
     * Record latency for an operation.
     */
    public void recordLatency(String component, String operation, long latencyMs) {
        String timerKey = component + "." + operation;
        Timer timer = timers.computeIfAbsent(timerKey, k ->
            Timer.builder("drcontrol.operation.latency")
                .tag("component", component)
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        
        timer.record(Duration.ofMillis(latencyMs));
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
}
