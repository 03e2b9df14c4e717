package com.platform.drcontrol.validation;

import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.model.BackupFreshness;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns validation facts into operator guidance using configurable thresholds.
 * 
 * Rules are independent and evaluated in a fixed order: consistency, replication lag,
 * newest backup age, oldest backup age. When none fires the list holds only {@link #ALL_CLEAR}.
 */
@Component
public class RecommendationEngine {
    
    public static final String ALL_CLEAR = "All validation checks passed. System is healthy.";
    
    private final DrControlProperties.Thresholds thresholds;
    
    public RecommendationEngine(DrControlProperties properties) {
        this.thresholds = properties.getThresholds();
    }
    
    public List<String> recommend(double consistencyScore,
                                  Optional<Long> replicationLagSeconds,
                                  BackupFreshness backup) {
        List<String> recommendations = new ArrayList<>();
        
        if (consistencyScore < thresholds.getMinConsistencyScore()) {
            recommendations.add(String.format(Locale.ROOT,
                "Data consistency is below %s%% (%.1f%%). Investigate mismatches immediately.",
                formatThreshold(thresholds.getMinConsistencyScore()), consistencyScore));
        }
        
        replicationLagSeconds
            .filter(lag -> lag > thresholds.getMaxReplicationLagSeconds())
            .ifPresent(lag -> recommendations.add(String.format(Locale.ROOT,
                "Replication lag is %d seconds. Consider investigating cross-region replication health.", lag)));
        
        backup.lastBackupAgeHours()
            .filter(age -> age > thresholds.getMaxBackupAgeHours())
            .ifPresent(age -> recommendations.add(String.format(Locale.ROOT,
                "Last backup is %.1f hours old. Consider running a manual backup.", age)));
        
        backup.oldestBackupAgeDays()
            .filter(age -> age > thresholds.getMaxBackupRetentionDays())
            .ifPresent(age -> recommendations.add(String.format(Locale.ROOT,
                "Oldest backup is %.0f days old. Consider reviewing retention policy.", age)));
        
        if (recommendations.isEmpty()) {
            recommendations.add(ALL_CLEAR);
        }
        return List.copyOf(recommendations);
    }
    
    private static String formatThreshold(double value) {
        return value == Math.rint(value)
            ? String.valueOf((long) value)
            : String.format(Locale.ROOT, "%.1f", value);
    }
}
