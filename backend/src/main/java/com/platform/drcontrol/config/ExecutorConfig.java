package com.platform.drcontrol.config;

import com.platform.drcontrol.observability.MdcTaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Executors and time source shared by the validation and probe paths.
 */
@Configuration
public class ExecutorConfig {
    
    public static final String VALIDATION_EXECUTOR = "validationExecutor";
    public static final String PROBE_EXECUTOR = "probeExecutor";
    
    @Bean(name = VALIDATION_EXECUTOR)
    public ThreadPoolTaskExecutor validationExecutor(DrControlProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getValidation().getWorkerThreads());
        executor.setMaxPoolSize(properties.getValidation().getWorkerThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("dr-validate-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
    
    @Bean(name = PROBE_EXECUTOR)
    public ThreadPoolTaskExecutor probeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("dr-probe-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
