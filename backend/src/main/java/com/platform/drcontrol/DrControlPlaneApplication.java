package com.platform.drcontrol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Disaster Recovery Control Plane Application
 * 
 * Watches a primary and a secondary (DR) region and decides when a region switch is safe:
 * - Cross-region consistency validation (count deltas, existence sampling, sentinel lag)
 * - Health-gated failover / failback with a durable transition record
 * - Backup freshness reporting and on-demand table backups
 * - Metric publication to the external collector
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class DrControlPlaneApplication {

    public static void main(String[] args) {
        SpringApplication.run(DrControlPlaneApplication.class, args);
    }
}
