package com.logwatch.anomaly.controller;

import com.logwatch.anomaly.service.BaselineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Liveness check that never touches the metric source")
public class HealthController {

    private final BaselineService baselineService;
    private final Clock clock;

    public HealthController(BaselineService baselineService, Clock clock) {
        this.baselineService = baselineService;
        this.clock = clock;
    }

    @GetMapping
    @Operation(summary = "Health check")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now(clock).toString());
        response.put("service", "log-anomaly-engine");
        response.put("snapshotVersion", baselineService.current().getVersion());
        return ResponseEntity.ok(response);
    }
}
