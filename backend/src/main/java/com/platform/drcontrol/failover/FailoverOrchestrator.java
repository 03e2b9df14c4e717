package com.platform.drcontrol.failover;

import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.model.FailoverAction;
import com.platform.drcontrol.model.FailoverOutcome;
import com.platform.drcontrol.model.FailoverOutcome.Reason;
import com.platform.drcontrol.model.FailoverRecord;
import com.platform.drcontrol.model.FailoverRequest;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.observability.LoggingConfig;
import com.platform.drcontrol.observability.MetricsRegistry;
import com.platform.drcontrol.probe.RegionHealthProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Health-gated region switch.
 * 
 * Each invocation is a one-shot decision:
 * - Unknown action or malformed region: rejected, nothing probed, nothing written
 * - Not forced and target unhealthy: rejected; writes a REJECTED record only when configured to
 * - Otherwise: a COMPLETED record overwrites the single failover slot
 * 
 * The probe-then-write sequence is not atomic across concurrent requests; the last write wins.
 * Failover and failback run the same algorithm and differ only in the recorded action.
 */
@Slf4j
@Service
public class FailoverOrchestrator {
    
    static final String MALFORMED_REQUEST_MESSAGE = "Malformed failover request body";
    
    private final RegionHealthProbe healthProbe;
    private final FailoverRecordStore recordStore;
    private final MetricsRegistry metricsRegistry;
    private final Region currentRegion;
    private final boolean recordRejectedAttempts;
    private final Clock clock;
    
    public FailoverOrchestrator(
            RegionHealthProbe healthProbe,
            FailoverRecordStore recordStore,
            MetricsRegistry metricsRegistry,
            DrControlProperties properties,
            Clock clock) {
        this.healthProbe = healthProbe;
        this.recordStore = recordStore;
        this.metricsRegistry = metricsRegistry;
        this.currentRegion = Region.parse("drcontrol.current-region", properties.getCurrentRegion());
        this.recordRejectedAttempts = properties.getFailover().isRecordRejectedAttempts();
        this.clock = clock;
    }
    
    /**
     * Handle a raw request. Never throws; every failure is a FAILED outcome.
     */
    public FailoverOutcome handle(String action, String targetRegion, boolean force) {
        Instant now = Instant.now(clock);
        
        Optional<FailoverAction> parsedAction = FailoverAction.fromWireName(action);
        if (parsedAction.isEmpty()) {
            log.warn("Rejecting failover request with invalid action '{}'", action);
            return finish(FailoverOutcome.failed(Reason.INVALID_ACTION, "Invalid action: " + action, action, now));
        }
        
        if (!Region.isValid(targetRegion)) {
            log.warn("Rejecting {} request with invalid target region '{}'", action, targetRegion);
            return finish(FailoverOutcome.failed(Reason.INVALID_REGION,
                "Invalid target region: " + targetRegion, action, now));
        }
        
        return handle(new FailoverRequest(parsedAction.get(), Region.of(targetRegion), force));
    }
    
    public FailoverOutcome handle(FailoverRequest request) {
        Instant now = Instant.now(clock);
        FailoverAction action = request.action();
        Region target = request.targetRegion();
        
        LoggingConfig.setOperationContext(action.wireName(), target.id());
        try {
            log.info("{} to {} requested (force={})", action.displayName(), target, request.force());
            
            if (!request.force() && !healthProbe.probe(target)) {
                return rejectUnhealthy(request, now);
            }
            if (request.force()) {
                log.warn("{} to {} forced, skipping health check", action.displayName(), target);
            }
            
            FailoverRecord record = FailoverRecord.completed(request, currentRegion, now);
            try {
                recordStore.save(record);
            } catch (RuntimeException e) {
                log.error("{} to {} could not be recorded: {}", action.displayName(), target, e.getMessage(), e);
                return finish(FailoverOutcome.failed(Reason.RECORD_WRITE_FAILED,
                    String.format("%s to region %s could not be recorded", action.displayName(), target),
                    action.wireName(), now));
            }
            
            log.info("{} from {} to {} completed", action.displayName(), currentRegion, target);
            return finish(FailoverOutcome.success(
                String.format("%s to region %s completed", action.displayName(), target), record));
            
        } finally {
            LoggingConfig.clearOperationContext();
        }
    }
    
    /**
     * Outcome for a request body that could not be read. Nothing is probed or written.
     */
    public FailoverOutcome rejectMalformedRequest(String detail) {
        log.warn("Rejecting unreadable failover request: {}", detail);
        return finish(FailoverOutcome.failed(Reason.MALFORMED_REQUEST, MALFORMED_REQUEST_MESSAGE, null,
            Instant.now(clock)));
    }
    
    /**
     * Latest recorded decision, if any.
     */
    public Optional<FailoverRecord> currentRecord() {
        return recordStore.current();
    }
    
    private FailoverOutcome rejectUnhealthy(FailoverRequest request, Instant now) {
        String message = String.format("Target region %s is not healthy. Use force=true to override.",
            request.targetRegion());
        log.warn("{} to {} rejected: target failed health check", request.action().displayName(), request.targetRegion());
        
        Optional<FailoverRecord> written = Optional.empty();
        if (recordRejectedAttempts) {
            FailoverRecord rejected = FailoverRecord.rejected(request, currentRegion, now);
            try {
                recordStore.save(rejected);
                written = Optional.of(rejected);
            } catch (RuntimeException e) {
                log.error("Rejected {} to {} could not be recorded: {}",
                    request.action().wireName(), request.targetRegion(), e.getMessage());
            }
        }
        return finish(FailoverOutcome.failed(Reason.TARGET_UNHEALTHY, message,
            request.action().wireName(), now, written));
    }
    
    private FailoverOutcome finish(FailoverOutcome outcome) {
        String actionTag = FailoverAction.fromWireName(outcome.action())
            .map(FailoverAction::wireName)
            .orElse("invalid");
        metricsRegistry.recordFailoverRequest(actionTag, outcome.reason().name().toLowerCase(Locale.ROOT));
        return outcome;
    }
}
