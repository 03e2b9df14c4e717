package com.platform.drcontrol.probe;

import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.config.ExecutorConfig;
import com.platform.drcontrol.connectors.RegionalDataStore;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.observability.MetricsRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Probes a region by issuing a bounded metadata listing against its storage endpoint.
 * 
 * Each call runs on the probe executor under a time limiter and a per-region circuit breaker
 * (shared config "region-probe"), so a region that keeps failing is reported unhealthy
 * without waiting for another timeout.
 */
@Slf4j
@Component
public class StorageRegionHealthProbe implements RegionHealthProbe {
    
    static final String CIRCUIT_BREAKER_CONFIG = "region-probe";
    
    private final RegionalDataStore dataStore;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final MetricsRegistry metricsRegistry;
    private final Executor probeExecutor;
    private final TimeLimiter timeLimiter;
    
    public StorageRegionHealthProbe(
            RegionalDataStore dataStore,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MetricsRegistry metricsRegistry,
            @Qualifier(ExecutorConfig.PROBE_EXECUTOR) Executor probeExecutor,
            DrControlProperties properties) {
        this.dataStore = dataStore;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.metricsRegistry = metricsRegistry;
        this.probeExecutor = probeExecutor;
        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(properties.getProbe().getTimeout())
            .cancelRunningFuture(true)
            .build());
    }
    
    @Override
    public boolean probe(Region region) {
        boolean healthy = doProbe(region);
        metricsRegistry.recordProbeResult(region.id(), healthy);
        return healthy;
    }
    
    private boolean doProbe(Region region) {
        CircuitBreaker circuitBreaker = circuitBreakerFor(region);
        try {
            circuitBreaker.executeCallable(() -> timeLimiter.executeFutureSupplier(() ->
                CompletableFuture.runAsync(() -> dataStore.ping(region), probeExecutor)));
            log.debug("Region {} storage probe succeeded", region);
            return true;
            
        } catch (CallNotPermittedException e) {
            log.warn("Region {} probe short-circuited: circuit breaker is {}", region, circuitBreaker.getState());
            return false;
            
        } catch (TimeoutException e) {
            log.warn("Region {} probe timed out after {}", region, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            return false;
            
        } catch (Exception e) {
            log.warn("Region {} probe failed: {}", region, rootMessage(e));
            return false;
        }
    }
    
    private CircuitBreaker circuitBreakerFor(Region region) {
        String name = CIRCUIT_BREAKER_CONFIG + "-" + region.id();
        if (circuitBreakerRegistry.getConfiguration(CIRCUIT_BREAKER_CONFIG).isPresent()) {
            return circuitBreakerRegistry.circuitBreaker(name, CIRCUIT_BREAKER_CONFIG);
        }
        return circuitBreakerRegistry.circuitBreaker(name);
    }
    
    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
