package com.platform.drcontrol.validation;

import com.platform.drcontrol.backup.BackupFreshnessService;
import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.error.BackendUnavailableException;
import com.platform.drcontrol.error.ValidationException;
import com.platform.drcontrol.model.AggregatedValidationReport;
import com.platform.drcontrol.model.BackupFreshness;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.model.RegionPair;
import com.platform.drcontrol.model.TableIdentifier;
import com.platform.drcontrol.model.TableValidationResult;
import com.platform.drcontrol.model.ValidationAction;
import com.platform.drcontrol.model.ValidationMode;
import com.platform.drcontrol.model.ValidationStatus;
import com.platform.drcontrol.observability.MetricsRegistry;
import com.platform.drcontrol.reporting.MetricsReporter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConsistencyValidator")
class ConsistencyValidatorTest {

    private static final RegionPair REGIONS = new RegionPair(Region.of("us-east-1"), Region.of("us-west-2"));
    private static final TableIdentifier APP_TABLE = TableIdentifier.of("dr-application-table");
    private static final TableIdentifier SENTINEL_TABLE = TableIdentifier.of("dr-sentinel-table");
    private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");

    @Mock
    private TableConsistencySampler sampler;

    @Mock
    private SentinelReplicationProber lagProber;

    @Mock
    private BackupFreshnessService backupFreshnessService;

    @Mock
    private MetricsReporter metricsReporter;

    private DrControlProperties properties;
    private ThreadPoolTaskExecutor executor;
    private ConsistencyValidator validator;

    @BeforeEach
    void setUp() {
        properties = new DrControlProperties();
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.initialize();

        validator = new ConsistencyValidator(
            sampler,
            lagProber,
            backupFreshnessService,
            new RecommendationEngine(properties),
            new SyncPlanner(),
            metricsReporter,
            new MetricsRegistry(new SimpleMeterRegistry()),
            executor,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Two clean tables with low lag and a fresh backup are healthy with the all-clear message")
    void shouldReportHealthyForCleanRun() {
        // Given
        when(sampler.sample(REGIONS, APP_TABLE)).thenReturn(result(APP_TABLE, 100, 100));
        when(sampler.sample(REGIONS, SENTINEL_TABLE)).thenReturn(result(SENTINEL_TABLE, 100, 100));
        when(lagProber.measureLag(REGIONS)).thenReturn(Optional.of(5L));
        when(backupFreshnessService.currentFreshness()).thenReturn(freshness(2.0));

        // When
        AggregatedValidationReport report = validator.validate(
            REGIONS, ValidationMode.FULL, Optional.empty(), ValidationAction.VALIDATE);

        // Then
        assertThat(report.consistencyScore()).isEqualTo(100.0);
        assertThat(report.status()).isEqualTo(ValidationStatus.HEALTHY);
        assertThat(report.mode()).isEqualTo(ValidationMode.FULL);
        assertThat(report.tablesValidated()).isEqualTo(2);
        assertThat(report.recordsChecked()).isEqualTo(200);
        assertThat(report.mismatchesFound()).isZero();
        assertThat(report.replicationLagSeconds()).contains(5L);
        assertThat(report.timestamp()).isEqualTo(NOW);
        assertThat(report.recommendations()).containsExactly("All validation checks passed. System is healthy.");
        assertThat(report.sync()).isEmpty();
        verify(metricsReporter).publishValidation(report);
    }

    @Test
    @DisplayName("Count delta plus sampled mismatches degrade the score")
    void shouldReportDegradedForMismatches() {
        // Given
        when(sampler.sample(REGIONS, APP_TABLE)).thenReturn(
            new TableValidationResult(APP_TABLE, 100, 90, List.of("Item a not found", "Item b not found")));
        when(lagProber.measureLag(REGIONS)).thenReturn(Optional.of(5L));
        when(backupFreshnessService.currentFreshness()).thenReturn(freshness(2.0));

        // When
        AggregatedValidationReport report = validator.validate(
            REGIONS, ValidationMode.SPECIFIC, Optional.of(APP_TABLE), ValidationAction.VALIDATE);

        // Then
        assertThat(report.mismatchesFound()).isEqualTo(12);
        assertThat(report.recordsChecked()).isEqualTo(100);
        assertThat(report.consistencyScore()).isEqualTo(88.0);
        assertThat(report.status()).isEqualTo(ValidationStatus.DEGRADED);
        assertThat(report.recommendations())
            .anyMatch(r -> r.startsWith("Data consistency is below 95% (88.0%)"));
        verify(sampler, never()).sample(REGIONS, SENTINEL_TABLE);
    }

    @Test
    @DisplayName("A failing table is excluded while the rest is still reported")
    void shouldExcludeFailingTable() {
        // Given
        when(sampler.sample(REGIONS, APP_TABLE))
            .thenThrow(BackendUnavailableException.storage("us-west-2", "describeTable", new RuntimeException("down")));
        when(sampler.sample(REGIONS, SENTINEL_TABLE)).thenReturn(result(SENTINEL_TABLE, 40, 40));
        when(lagProber.measureLag(REGIONS)).thenReturn(Optional.empty());
        when(backupFreshnessService.currentFreshness()).thenReturn(BackupFreshness.unknown());

        // When
        AggregatedValidationReport report = validator.validate(
            REGIONS, ValidationMode.INCREMENTAL, Optional.empty(), ValidationAction.VALIDATE);

        // Then
        assertThat(report.tablesValidated()).isEqualTo(1);
        assertThat(report.recordsChecked()).isEqualTo(40);
        assertThat(report.replicationLagSeconds()).isEmpty();
        assertThat(report.status()).isEqualTo(ValidationStatus.HEALTHY);
    }

    @Test
    @DisplayName("A table that exceeds its timeout is abandoned and excluded")
    void shouldAbandonSlowTable() {
        // Given
        properties.getValidation().setTableTimeout(Duration.ofMillis(200));
        when(sampler.sample(REGIONS, APP_TABLE)).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return result(APP_TABLE, 1, 1);
        });
        when(sampler.sample(REGIONS, SENTINEL_TABLE)).thenReturn(result(SENTINEL_TABLE, 10, 10));
        when(lagProber.measureLag(REGIONS)).thenReturn(Optional.of(1L));
        when(backupFreshnessService.currentFreshness()).thenReturn(BackupFreshness.unknown());

        // When
        long start = System.nanoTime();
        AggregatedValidationReport report = validator.validate(
            REGIONS, ValidationMode.FULL, Optional.empty(), ValidationAction.VALIDATE);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        // Then
        assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
        assertThat(report.tablesValidated()).isEqualTo(1);
        assertThat(report.recordsChecked()).isEqualTo(10);
    }

    @Test
    @DisplayName("No validated table means a vacuously healthy score")
    void shouldBeVacuouslyHealthyWhenEveryTableFails() {
        // Given
        when(sampler.sample(any(), any()))
            .thenThrow(BackendUnavailableException.storage("us-east-1", "describeTable", new RuntimeException("down")));
        when(lagProber.measureLag(REGIONS)).thenReturn(Optional.empty());
        when(backupFreshnessService.currentFreshness()).thenReturn(BackupFreshness.unknown());

        // When
        AggregatedValidationReport report = validator.validate(
            REGIONS, ValidationMode.FULL, Optional.empty(), ValidationAction.VALIDATE);

        // Then
        assertThat(report.tablesValidated()).isZero();
        assertThat(report.consistencyScore()).isEqualTo(100.0);
        assertThat(report.status()).isEqualTo(ValidationStatus.HEALTHY);
        assertThat(report.recommendations()).isNotEmpty();
    }

    @Test
    @DisplayName("Sync reports pending items without adding recommendations")
    void shouldAttachSyncSummary() {
        // Given
        when(sampler.sample(REGIONS, APP_TABLE)).thenReturn(result(APP_TABLE, 100, 90));
        when(lagProber.measureLag(REGIONS)).thenReturn(Optional.of(2L));
        when(backupFreshnessService.currentFreshness()).thenReturn(freshness(1.0));

        // When
        AggregatedValidationReport report = validator.validate(
            REGIONS, ValidationMode.SPECIFIC, Optional.of(APP_TABLE), ValidationAction.SYNC);

        // Then
        assertThat(report.sync()).hasValueSatisfying(sync -> {
            assertThat(sync.itemsPending()).isEqualTo(10);
            assertThat(sync.performed()).isFalse();
        });
        assertThat(report.recommendations()).hasSize(1);
    }

    @Test
    @DisplayName("Specific mode without a table is rejected before any work starts")
    void shouldRejectSpecificModeWithoutTable() {
        assertThatThrownBy(() -> validator.validate(
                REGIONS, ValidationMode.SPECIFIC, Optional.empty(), ValidationAction.VALIDATE))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("table_name");

        verifyNoInteractions(sampler, lagProber, backupFreshnessService, metricsReporter);
    }

    @Test
    @DisplayName("A saturated worker pool excludes tables and lag instead of failing the run")
    void shouldDegradeGracefullyWhenPoolRejectsWork() throws Exception {
        // Given
        ThreadPoolTaskExecutor saturated = new ThreadPoolTaskExecutor();
        saturated.setCorePoolSize(1);
        saturated.setMaxPoolSize(1);
        saturated.setQueueCapacity(1);
        saturated.initialize();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch running = new CountDownLatch(1);
        saturated.execute(() -> {
            running.countDown();
            awaitQuietly(release);
        });
        saturated.execute(() -> awaitQuietly(release));
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        ConsistencyValidator saturatedValidator = new ConsistencyValidator(
            sampler,
            lagProber,
            backupFreshnessService,
            new RecommendationEngine(properties),
            new SyncPlanner(),
            metricsReporter,
            new MetricsRegistry(meterRegistry),
            saturated,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC));
        when(backupFreshnessService.currentFreshness()).thenReturn(freshness(2.0));

        try {
            // When
            AggregatedValidationReport report = saturatedValidator.validate(
                REGIONS, ValidationMode.FULL, Optional.empty(), ValidationAction.VALIDATE);

            // Then
            assertThat(report.tablesValidated()).isZero();
            assertThat(report.recordsChecked()).isZero();
            assertThat(report.consistencyScore()).isEqualTo(100.0);
            assertThat(report.replicationLagSeconds()).isEmpty();
            assertThat(meterRegistry.find("drcontrol.validation.table_failures").counters()).hasSize(2);
            assertThat(meterRegistry.get("drcontrol.validation.lag_probe").tag("observed", "false").counter().count())
                .isEqualTo(1.0);
            verifyNoInteractions(sampler, lagProber);
            verify(metricsReporter).publishValidation(report);
        } finally {
            release.countDown();
            saturated.shutdown();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static TableValidationResult result(TableIdentifier table, long primary, long secondary) {
        return new TableValidationResult(table, primary, secondary, List.of());
    }

    private static BackupFreshness freshness(double lastBackupAgeHours) {
        return new BackupFreshness(Optional.of(lastBackupAgeHours), 3, Optional.of(5.0));
    }
}
