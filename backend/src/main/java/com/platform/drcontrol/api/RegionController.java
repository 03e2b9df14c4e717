package com.platform.drcontrol.api;

import com.platform.drcontrol.api.dto.RegionHealthResponse;
import com.platform.drcontrol.api.dto.RegionProbeResponse;
import com.platform.drcontrol.health.RegionHealthService;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.probe.RegionHealthProbe;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for per-region health.
 */
@RestController
@RequestMapping("/api/regions/{region}")
@RequiredArgsConstructor
public class RegionController {
    
    private final RegionHealthProbe healthProbe;
    private final RegionHealthService healthService;
    
    /**
     * Full health report; also published to the metrics collector.
     */
    @GetMapping("/health")
    public ResponseEntity<RegionHealthResponse> health(@PathVariable String region) {
        return ResponseEntity.ok(RegionHealthResponse.from(healthService.check(Region.parse("region", region))));
    }
    
    /**
     * Storage reachability only, exactly as the failover gate sees it.
     */
    @GetMapping("/probe")
    public ResponseEntity<RegionProbeResponse> probe(@PathVariable String region) {
        Region parsed = Region.parse("region", region);
        return ResponseEntity.ok(new RegionProbeResponse(parsed.id(), healthProbe.probe(parsed)));
    }
}
