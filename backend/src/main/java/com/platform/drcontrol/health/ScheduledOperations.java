package com.platform.drcontrol.health;

import com.platform.drcontrol.backup.BackupManager;
import com.platform.drcontrol.backup.BackupType;
import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.error.ControlPlaneException;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.model.TableIdentifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Optional timers for region health checks and daily backups. Both are off unless enabled.
 */
@Configuration
public class ScheduledOperations {
    
    @Bean
    @ConditionalOnProperty(name = "drcontrol.scheduling.health-check.enabled", havingValue = "true")
    public HealthCheckTrigger healthCheckTrigger(RegionHealthService healthService, DrControlProperties properties) {
        return new HealthCheckTrigger(healthService, properties);
    }
    
    @Bean
    @ConditionalOnProperty(name = "drcontrol.scheduling.backup.enabled", havingValue = "true")
    public BackupTrigger backupTrigger(BackupManager backupManager, DrControlProperties properties) {
        return new BackupTrigger(backupManager, properties);
    }
    
    @Slf4j
    public static class HealthCheckTrigger {
        
        private final RegionHealthService healthService;
        private final DrControlProperties properties;
        
        HealthCheckTrigger(RegionHealthService healthService, DrControlProperties properties) {
            this.healthService = healthService;
            this.properties = properties;
        }
        
        @Scheduled(
            fixedDelayString = "${drcontrol.scheduling.health-check.interval-ms:60000}",
            initialDelayString = "${drcontrol.scheduling.health-check.initial-delay-ms:10000}")
        public void run() {
            for (String region : new String[]{properties.getDefaultSourceRegion(), properties.getDefaultTargetRegion()}) {
                try {
                    healthService.check(Region.of(region));
                } catch (RuntimeException e) {
                    log.error("Scheduled health check of {} failed: {}", region, e.getMessage(), e);
                }
            }
        }
    }
    
    @Slf4j
    public static class BackupTrigger {
        
        private final BackupManager backupManager;
        private final DrControlProperties properties;
        
        BackupTrigger(BackupManager backupManager, DrControlProperties properties) {
            this.backupManager = backupManager;
            this.properties = properties;
        }
        
        @Scheduled(cron = "${drcontrol.scheduling.backup.cron:0 0 2 * * *}")
        public void run() {
            for (String table : properties.getValidation().getDefaultTables()) {
                try {
                    backupManager.runBackup(TableIdentifier.of(table), BackupType.FULL);
                } catch (ControlPlaneException e) {
                    log.error("Scheduled backup of {} failed: {}", table, e.getMessage());
                }
            }
        }
    }
}
