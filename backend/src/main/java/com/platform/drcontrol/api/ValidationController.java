package com.platform.drcontrol.api;

import com.platform.drcontrol.api.dto.ValidationRequest;
import com.platform.drcontrol.api.dto.ValidationResponse;
import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.model.AggregatedValidationReport;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.model.RegionPair;
import com.platform.drcontrol.model.TableIdentifier;
import com.platform.drcontrol.model.ValidationAction;
import com.platform.drcontrol.model.ValidationMode;
import com.platform.drcontrol.validation.ConsistencyValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * REST API for cross-region consistency validation.
 * Runs synchronously; a run can take as long as the replication lag probe.
 */
@Slf4j
@RestController
@RequestMapping("/api/validation")
@RequiredArgsConstructor
public class ValidationController {
    
    private final ConsistencyValidator validator;
    private final DrControlProperties properties;
    
    @PostMapping
    public ResponseEntity<ValidationResponse> validate(@RequestBody(required = false) ValidationRequest request) {
        ValidationRequest effective = request != null ? request : ValidationRequest.defaults();
        
        ValidationMode mode = Optional.ofNullable(effective.validationMode()).orElse(ValidationMode.INCREMENTAL);
        ValidationAction action = Optional.ofNullable(effective.action()).orElse(ValidationAction.VALIDATE);
        RegionPair regions = new RegionPair(
            Region.parse("source_region", Optional.ofNullable(effective.sourceRegion())
                .orElse(properties.getDefaultSourceRegion())),
            Region.parse("target_region", Optional.ofNullable(effective.targetRegion())
                .orElse(properties.getDefaultTargetRegion())));
        Optional<TableIdentifier> table = Optional.ofNullable(effective.tableName())
            .filter(name -> !name.isBlank())
            .map(TableIdentifier::of);
        
        AggregatedValidationReport report = validator.validate(regions, mode, table, action);
        return ResponseEntity.ok(ValidationResponse.from(report));
    }
}
