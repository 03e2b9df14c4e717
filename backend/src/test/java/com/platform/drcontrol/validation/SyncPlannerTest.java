package com.platform.drcontrol.validation;

import com.platform.drcontrol.model.SyncSummary;
import com.platform.drcontrol.model.TableIdentifier;
import com.platform.drcontrol.model.TableValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SyncPlanner")
class SyncPlannerTest {

    private final SyncPlanner planner = new SyncPlanner();

    @Test
    @DisplayName("Should sum pending items over tables with mismatches only")
    void shouldSumPendingItems() {
        List<TableValidationResult> results = List.of(
            new TableValidationResult(TableIdentifier.of("a"), 100, 90, List.of()),
            new TableValidationResult(TableIdentifier.of("b"), 50, 50, List.of("x", "y", "z")),
            new TableValidationResult(TableIdentifier.of("c"), 10, 10, List.of()));

        SyncSummary summary = planner.plan(results);

        assertThat(summary.itemsPending()).isEqualTo(13);
        assertThat(summary.performed()).isFalse();
    }

    @Test
    @DisplayName("A secondary holding more items than the primary has nothing to copy")
    void shouldIgnoreNegativeDelta() {
        TableValidationResult result = new TableValidationResult(TableIdentifier.of("a"), 90, 100, List.of());

        assertThat(planner.pendingItems(result)).isZero();
    }
}
