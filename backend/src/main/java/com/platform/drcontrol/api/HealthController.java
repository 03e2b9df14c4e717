package com.platform.drcontrol.api;

import com.platform.drcontrol.config.DrControlProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness of the control plane itself. Regional health lives under /api/regions.
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {
    
    private final DrControlProperties properties;
    
    @GetMapping("/live")
    public ResponseEntity<Map<String, String>> live() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "region", properties.getCurrentRegion()
        ));
    }
}
