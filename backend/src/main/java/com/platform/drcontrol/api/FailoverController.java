package com.platform.drcontrol.api;

import com.platform.drcontrol.api.dto.FailoverRequestDto;
import com.platform.drcontrol.api.dto.FailoverResponse;
import com.platform.drcontrol.api.dto.FailoverStatusResponse;
import com.platform.drcontrol.error.ResourceNotFoundException;
import com.platform.drcontrol.failover.FailoverOrchestrator;
import com.platform.drcontrol.model.FailoverOutcome;
import com.platform.drcontrol.model.FailoverRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for failover and failback.
 * Every request gets a failover response body; the HTTP status reflects why it failed.
 */
@Slf4j
@RestController
@RequestMapping("/api/failover")
@RequiredArgsConstructor
public class FailoverController {
    
    private final FailoverOrchestrator orchestrator;
    
    @PostMapping
    public ResponseEntity<FailoverResponse> failover(@RequestBody FailoverRequestDto request) {
        FailoverOutcome outcome = orchestrator.handle(request.action(), request.targetRegion(), request.forceOrDefault());
        return ResponseEntity.status(statusFor(outcome)).body(FailoverResponse.from(outcome));
    }
    
    /**
     * Latest recorded failover decision.
     */
    @GetMapping("/status")
    public ResponseEntity<FailoverStatusResponse> status() {
        return orchestrator.currentRecord()
            .map(FailoverStatusResponse::from)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> ResourceNotFoundException.failoverRecord(FailoverRecord.RECORD_ID));
    }
    
    /**
     * An unreadable body still gets a failover response rather than the generic error shape.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<FailoverResponse> unreadableRequest(HttpMessageNotReadableException ex) {
        FailoverOutcome outcome = orchestrator.rejectMalformedRequest(ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(statusFor(outcome)).body(FailoverResponse.from(outcome));
    }
    
    static HttpStatus statusFor(FailoverOutcome outcome) {
        return switch (outcome.reason()) {
            case COMPLETED -> HttpStatus.OK;
            case MALFORMED_REQUEST, INVALID_ACTION, INVALID_REGION -> HttpStatus.BAD_REQUEST;
            case TARGET_UNHEALTHY -> HttpStatus.CONFLICT;
            case RECORD_WRITE_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
