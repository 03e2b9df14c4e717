package com.platform.drcontrol.validation;

import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.model.BackupFreshness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RecommendationEngine")
class RecommendationEngineTest {

    private DrControlProperties properties;
    private RecommendationEngine engine;

    @BeforeEach
    void setUp() {
        properties = new DrControlProperties();
        engine = new RecommendationEngine(properties);
    }

    @Test
    @DisplayName("Should emit only the all-clear message when no rule fires")
    void shouldEmitAllClear() {
        List<String> recommendations = engine.recommend(100.0, Optional.of(5L), freshness(2.0, 3.0));

        assertThat(recommendations).containsExactly(RecommendationEngine.ALL_CLEAR);
    }

    @Test
    @DisplayName("Should emit all-clear when lag and backups are unknown")
    void shouldTreatUnknownFactsAsNotFiring() {
        List<String> recommendations = engine.recommend(99.0, Optional.empty(), BackupFreshness.unknown());

        assertThat(recommendations).containsExactly(RecommendationEngine.ALL_CLEAR);
    }

    @Test
    @DisplayName("Should fire every rule in evaluation order")
    void shouldFireAllRulesInOrder() {
        List<String> recommendations = engine.recommend(88.0, Optional.of(120L), freshness(30.5, 45.0));

        assertThat(recommendations).containsExactly(
            "Data consistency is below 95% (88.0%). Investigate mismatches immediately.",
            "Replication lag is 120 seconds. Consider investigating cross-region replication health.",
            "Last backup is 30.5 hours old. Consider running a manual backup.",
            "Oldest backup is 45 days old. Consider reviewing retention policy."
        );
        assertThat(recommendations).doesNotContain(RecommendationEngine.ALL_CLEAR);
    }

    @Test
    @DisplayName("Thresholds are exclusive for lag and backup age")
    void thresholdsAreExclusive() {
        List<String> recommendations = engine.recommend(95.0, Optional.of(60L), freshness(24.0, 30.0));

        assertThat(recommendations).containsExactly(RecommendationEngine.ALL_CLEAR);
    }

    @Test
    @DisplayName("Should honour configured thresholds")
    void shouldHonourConfiguredThresholds() {
        properties.getThresholds().setMaxReplicationLagSeconds(10);
        properties.getThresholds().setMinConsistencyScore(99.5);

        List<String> recommendations = engine.recommend(99.0, Optional.of(11L), BackupFreshness.unknown());

        assertThat(recommendations).hasSize(2);
        assertThat(recommendations.get(0)).startsWith("Data consistency is below 99.5% (99.0%)");
        assertThat(recommendations.get(1)).startsWith("Replication lag is 11 seconds");
    }

    private static BackupFreshness freshness(double lastHours, double oldestDays) {
        return new BackupFreshness(Optional.of(lastHours), 4, Optional.of(oldestDays));
    }
}
