package com.platform.drcontrol.validation;

import com.platform.drcontrol.model.SyncSummary;
import com.platform.drcontrol.model.TableValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reports how many items a reconciliation would have to copy. Never copies anything.
 */
@Slf4j
@Component
public class SyncPlanner {
    
    /**
     * Items missing from the secondary for one table: the positive count delta, or the sampled
     * mismatches when counts agree but the sample still found gaps.
     */
    public long pendingItems(TableValidationResult result) {
        long countDelta = Math.max(0L, result.primaryCount() - result.secondaryCount());
        return Math.max(countDelta, result.sampledMismatches().size());
    }
    
    public SyncSummary plan(List<TableValidationResult> results) {
        long pending = 0;
        for (TableValidationResult result : results) {
            if (!result.hasMismatches()) {
                continue;
            }
            long tablePending = pendingItems(result);
            log.info("Sync of {} would reconcile {} items (not performed)", result.table(), tablePending);
            pending += tablePending;
        }
        return SyncSummary.pending(pending);
    }
}
