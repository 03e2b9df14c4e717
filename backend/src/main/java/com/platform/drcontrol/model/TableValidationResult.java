package com.platform.drcontrol.model;

import java.util.List;

/**
 * Outcome of sampling one table across both regions.
 * 
 * @param table the table that was sampled
 * @param primaryCount approximate item count in the primary region
 * @param secondaryCount approximate item count in the secondary region
 * @param sampledMismatches one entry per sampled item missing (or unreadable) in the secondary
 */
public record TableValidationResult(
    TableIdentifier table,
    long primaryCount,
    long secondaryCount,
    List<String> sampledMismatches
) {
    
    public TableValidationResult {
        if (primaryCount < 0 || secondaryCount < 0) {
            throw new IllegalArgumentException("Item counts must be non-negative");
        }
        sampledMismatches = List.copyOf(sampledMismatches);
    }
    
    /**
     * Count delta plus sampled mismatches. Both sources may describe the same missing item.
     */
    public long mismatchCount() {
        return Math.abs(primaryCount - secondaryCount) + sampledMismatches.size();
    }
    
    public boolean hasMismatches() {
        return mismatchCount() > 0;
    }
}
