package com.platform.drcontrol.validation;

import com.platform.drcontrol.backup.BackupFreshnessService;
import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.config.ExecutorConfig;
import com.platform.drcontrol.error.ErrorCode;
import com.platform.drcontrol.error.ValidationException;
import com.platform.drcontrol.model.AggregatedValidationReport;
import com.platform.drcontrol.model.BackupFreshness;
import com.platform.drcontrol.model.RegionPair;
import com.platform.drcontrol.model.SyncSummary;
import com.platform.drcontrol.model.TableIdentifier;
import com.platform.drcontrol.model.TableValidationResult;
import com.platform.drcontrol.model.ValidationAction;
import com.platform.drcontrol.model.ValidationMode;
import com.platform.drcontrol.model.ValidationStatus;
import com.platform.drcontrol.observability.LoggingConfig;
import com.platform.drcontrol.observability.MetricsRegistry;
import com.platform.drcontrol.reporting.MetricsReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cross-region consistency validation.
 * 
 * One run:
 * 1. Samples every selected table and measures replication lag concurrently
 * 2. Waits for each sub-result under its own deadline, cancelling stragglers
 * 3. Reads backup freshness
 * 4. Builds one immutable report, then publishes its score and mismatch count
 * 
 * A table that fails, times out or is rejected by a saturated pool is excluded from the
 * aggregate. Lag and backup failures become absent values. Only invalid input aborts a run.
 */
@Slf4j
@Service
public class ConsistencyValidator {
    
    private final TableConsistencySampler sampler;
    private final SentinelReplicationProber lagProber;
    private final BackupFreshnessService backupFreshnessService;
    private final RecommendationEngine recommendationEngine;
    private final SyncPlanner syncPlanner;
    private final MetricsReporter metricsReporter;
    private final MetricsRegistry metricsRegistry;
    private final AsyncTaskExecutor executor;
    private final DrControlProperties properties;
    private final Clock clock;
    
    public ConsistencyValidator(
            TableConsistencySampler sampler,
            SentinelReplicationProber lagProber,
            BackupFreshnessService backupFreshnessService,
            RecommendationEngine recommendationEngine,
            SyncPlanner syncPlanner,
            MetricsReporter metricsReporter,
            MetricsRegistry metricsRegistry,
            @Qualifier(ExecutorConfig.VALIDATION_EXECUTOR) AsyncTaskExecutor executor,
            DrControlProperties properties,
            Clock clock) {
        this.sampler = sampler;
        this.lagProber = lagProber;
        this.backupFreshnessService = backupFreshnessService;
        this.recommendationEngine = recommendationEngine;
        this.syncPlanner = syncPlanner;
        this.metricsReporter = metricsReporter;
        this.metricsRegistry = metricsRegistry;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }
    
    public AggregatedValidationReport validate(RegionPair regions,
                                               ValidationMode mode,
                                               Optional<TableIdentifier> tableFilter,
                                               ValidationAction action) {
        List<TableIdentifier> tables = selectTables(mode, tableFilter);
        long startNanos = System.nanoTime();
        
        LoggingConfig.setOperationContext("validation", regions.primary() + "->" + regions.secondary());
        Optional<Future<Optional<Long>>> lagFuture = Optional.empty();
        Map<TableIdentifier, Future<TableValidationResult>> sampleFutures = new LinkedHashMap<>();
        try {
            log.info("Starting {} validation ({}) of {} table(s) {} -> {}",
                mode.wireName(), action.wireName(), tables.size(), regions.primary(), regions.secondary());
            
            // ==================== Fan out ====================
            
            lagFuture = submit("replication lag probe", () -> lagProber.measureLag(regions));
            for (TableIdentifier table : tables) {
                Optional<Future<TableValidationResult>> future =
                    submit("sampling of " + table, () -> sampler.sample(regions, table));
                if (future.isPresent()) {
                    sampleFutures.put(table, future.get());
                } else {
                    metricsRegistry.recordTableSampleFailure(table.name());
                }
            }
            
            BackupFreshness backup = backupFreshnessService.currentFreshness();
            
            // ==================== Join ====================
            
            long tableDeadline = startNanos + properties.getValidation().getTableTimeout().toNanos();
            List<TableValidationResult> results = new ArrayList<>();
            sampleFutures.forEach((table, future) ->
                awaitTable(table, future, tableDeadline).ifPresent(results::add));
            
            long lagDeadline = startNanos + properties.getSentinel().maxMeasurementTime().toNanos();
            Optional<Long> lag = lagFuture.isPresent()
                ? awaitLag(lagFuture.get(), lagDeadline)
                : noLagSignal();
            
            // ==================== Aggregate ====================
            
            AggregatedValidationReport report = aggregate(mode, action, results, lag, backup);
            
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            log.info("Validation finished in {}ms: status={}, score={}, tables={}/{}, mismatches={}",
                durationMs, report.status().wireName(), report.consistencyScore(),
                report.tablesValidated(), tables.size(), report.mismatchesFound());
            
            metricsRegistry.recordValidationRun(report.status().wireName(), report.consistencyScore(), durationMs);
            metricsReporter.publishValidation(report);
            return report;
            
        } finally {
            // completed futures ignore cancel; only work left by an aborted run is stopped
            lagFuture.ifPresent(future -> future.cancel(true));
            sampleFutures.values().forEach(future -> future.cancel(true));
            LoggingConfig.clearOperationContext();
        }
    }
    
    AggregatedValidationReport aggregate(ValidationMode mode,
                                         ValidationAction action,
                                         List<TableValidationResult> results,
                                         Optional<Long> lag,
                                         BackupFreshness backup) {
        long recordsChecked = results.stream().mapToLong(TableValidationResult::primaryCount).sum();
        long mismatchesFound = results.stream().mapToLong(TableValidationResult::mismatchCount).sum();
        
        double score = ConsistencyScoring.score(recordsChecked, mismatchesFound);
        ValidationStatus status = ConsistencyScoring.status(score, properties.getThresholds().getMinConsistencyScore());
        
        Optional<SyncSummary> sync = action == ValidationAction.SYNC
            ? Optional.of(syncPlanner.plan(results))
            : Optional.empty();
        
        return AggregatedValidationReport.builder()
            .status(status)
            .mode(mode)
            .timestamp(Instant.now(clock))
            .tablesValidated(results.size())
            .recordsChecked(recordsChecked)
            .mismatchesFound(mismatchesFound)
            .replicationLagSeconds(lag)
            .backup(backup)
            .consistencyScore(score)
            .recommendations(recommendationEngine.recommend(score, lag, backup))
            .sync(sync)
            .build();
    }
    
    private List<TableIdentifier> selectTables(ValidationMode mode, Optional<TableIdentifier> tableFilter) {
        if (tableFilter.isPresent()) {
            return List.of(tableFilter.get());
        }
        if (mode == ValidationMode.SPECIFIC) {
            throw new ValidationException(ErrorCode.MISSING_REQUIRED_FIELD, "table_name", null, "required when validation_mode is specific");
        }
        return properties.getValidation().getDefaultTables().stream()
            .map(TableIdentifier::of)
            .toList();
    }
    
    private Optional<TableValidationResult> awaitTable(TableIdentifier table,
                                                       Future<TableValidationResult> future,
                                                       long deadlineNanos) {
        try {
            return Optional.of(future.get(remaining(deadlineNanos), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Sampling {} timed out after {}, excluding it", table, properties.getValidation().getTableTimeout());
        } catch (ExecutionException e) {
            log.error("Sampling {} failed, excluding it: {}", table, e.getCause().getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {}, excluding it", table);
        }
        metricsRegistry.recordTableSampleFailure(table.name());
        return Optional.empty();
    }
    
    private Optional<Long> awaitLag(Future<Optional<Long>> future, long deadlineNanos) {
        Optional<Long> lag;
        try {
            lag = future.get(remaining(deadlineNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Replication lag probe exceeded {}, no signal", properties.getSentinel().maxMeasurementTime());
            lag = Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Replication lag probe failed, no signal: {}", e.getCause().getMessage());
            lag = Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            lag = Optional.empty();
        }
        metricsRegistry.recordLagMeasurement(lag.isPresent());
        return lag;
    }
    
    /**
     * Submits to the validation pool. A saturated pool rejects the task instead of failing the run.
     */
    private <T> Optional<Future<T>> submit(String task, Callable<T> work) {
        try {
            return Optional.of(executor.submit(work));
        } catch (TaskRejectedException e) {
            log.warn("Validation pool rejected {}, skipping it: {}", task, e.getMessage());
            return Optional.empty();
        }
    }
    
    private Optional<Long> noLagSignal() {
        metricsRegistry.recordLagMeasurement(false);
        return Optional.empty();
    }
    
    private static long remaining(long deadlineNanos) {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }
}
