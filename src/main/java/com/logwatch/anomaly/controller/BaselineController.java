package com.logwatch.anomaly.controller;

import com.logwatch.anomaly.model.Baseline;
import com.logwatch.anomaly.model.BaselineSnapshot;
import com.logwatch.anomaly.service.BaselineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/baselines")
@Tag(name = "Baselines", description = "Per service, metric, hour and weekday expected distributions")
public class BaselineController {

    private final BaselineService baselineService;

    public BaselineController(BaselineService baselineService) {
        this.baselineService = baselineService;
    }

    @GetMapping
    @Operation(summary = "Get the current baseline snapshot",
               description = "Optionally restricted to one service")
    public ResponseEntity<Map<String, Object>> getBaselines(@RequestParam(required = false) String service) {
        return ResponseEntity.ok(describe(baselineService.current(), service));
    }

    @PostMapping("/recompute")
    @Operation(summary = "Recompute baselines now",
               description = "Returns 409 if a recomputation is already running")
    public ResponseEntity<Map<String, Object>> recompute() {
        Optional<BaselineSnapshot> snapshot = baselineService.recompute();
        if (snapshot.isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "RECOMPUTE_IN_PROGRESS",
                                 "message", "a baseline recomputation is already running"));
        }
        return ResponseEntity.ok(describe(snapshot.get(), null));
    }

    private static Map<String, Object> describe(BaselineSnapshot snapshot, String service) {
        List<Baseline> baselines = snapshot.getBaselines().stream()
                .filter(b -> service == null || service.equals(b.getService()))
                .sorted(Comparator.comparing(Baseline::getService)
                        .thenComparing(Baseline::getMetric)
                        .thenComparingInt(Baseline::getDayOfWeek)
                        .thenComparingInt(Baseline::getHourOfDay))
                .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("version", snapshot.getVersion());
        response.put("computedAt", snapshot.getComputedAt());
        response.put("zone", snapshot.getZone().getId());
        response.put("count", baselines.size());
        response.put("baselines", baselines);
        if (service != null) {
            response.put("knownSignatures", snapshot.knownSignatures(service).orElse(Set.of()));
            response.put("knownRegions", snapshot.knownRegions(service).orElse(Set.of()));
        }
        return response;
    }
}
