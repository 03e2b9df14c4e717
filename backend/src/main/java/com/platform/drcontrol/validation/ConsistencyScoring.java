package com.platform.drcontrol.validation;

import com.platform.drcontrol.model.ValidationStatus;

/**
 * Pure scoring rules for a validation run.
 */
public final class ConsistencyScoring {
    
    public static final double PERFECT_SCORE = 100.0;
    
    private ConsistencyScoring() {
    }
    
    /**
     * Percentage of checked records estimated to match.
     * 100 when nothing was checked; never below 0 even when mismatches exceed records,
     * which happens because count deltas and sampled mismatches may describe the same item.
     */
    public static double score(long recordsChecked, long mismatchesFound) {
        if (recordsChecked <= 0) {
            return PERFECT_SCORE;
        }
        double score = PERFECT_SCORE * (recordsChecked - mismatchesFound) / recordsChecked;
        return Math.max(0.0, score);
    }
    
    /**
     * HEALTHY iff the score reaches the threshold. FAILED is never produced here.
     */
    public static ValidationStatus status(double score, double minConsistencyScore) {
        return score >= minConsistencyScore ? ValidationStatus.HEALTHY : ValidationStatus.DEGRADED;
    }
}
