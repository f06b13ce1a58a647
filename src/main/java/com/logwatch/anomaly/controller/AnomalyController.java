package com.logwatch.anomaly.controller;

import com.logwatch.anomaly.model.Alert;
import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.model.AnomalyStatus;
import com.logwatch.anomaly.model.Feedback;
import com.logwatch.anomaly.model.FeedbackType;
import com.logwatch.anomaly.model.PagedResponse;
import com.logwatch.anomaly.model.Severity;
import com.logwatch.anomaly.service.AlertManagerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Browse detected anomalies and drive their lifecycle")
public class AnomalyController {

    private static final String DEFAULT_ACTOR = "ops";

    private final AlertManagerService alertManagerService;

    public AnomalyController(AlertManagerService alertManagerService) {
        this.alertManagerService = alertManagerService;
    }

    @GetMapping
    @Operation(summary = "List anomalies",
               description = "Newest first. Pass the returned nextCursor as 'before' to fetch the next page.")
    public ResponseEntity<PagedResponse<Anomaly>> listAnomalies(
            @RequestParam(required = false) Long from,
            @RequestParam(required = false) Long to,
            @RequestParam(required = false) String service,
            @RequestParam(required = false) AnomalyStatus status,
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) String ruleId,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(required = false) Long before) {
        if (limit < 1 || limit > 1000) {
            throw new IllegalArgumentException("limit must be between 1 and 1000");
        }
        return ResponseEntity.ok(alertManagerService.search(from, to, service, status, severity, ruleId, limit, before));
    }

    @GetMapping("/{anomalyId}")
    @Operation(summary = "Get a single anomaly")
    public ResponseEntity<Anomaly> getAnomaly(@PathVariable String anomalyId) {
        return ResponseEntity.ok(alertManagerService.getAnomaly(anomalyId));
    }

    @PostMapping("/{anomalyId}/acknowledge")
    @Operation(summary = "Acknowledge an anomaly",
               description = "NEW -> ACKNOWLEDGED. Also stamps the acknowledgement on the anomaly's alerts. Repeating is a no-op.")
    public ResponseEntity<Anomaly> acknowledge(@PathVariable String anomalyId,
                                               @RequestBody(required = false) Map<String, String> body) {
        return ResponseEntity.ok(alertManagerService.acknowledge(anomalyId, actor(body), note(body)));
    }

    @PostMapping("/{anomalyId}/resolve")
    @Operation(summary = "Resolve an acknowledged anomaly")
    public ResponseEntity<Anomaly> resolve(@PathVariable String anomalyId,
                                           @RequestBody(required = false) Map<String, String> body) {
        return ResponseEntity.ok(alertManagerService.resolve(anomalyId, actor(body), note(body)));
    }

    @PostMapping("/{anomalyId}/false-positive")
    @Operation(summary = "Dismiss an anomaly as a false positive",
               description = "Records FALSE_POSITIVE feedback against the rule that raised it")
    public ResponseEntity<Anomaly> markFalsePositive(@PathVariable String anomalyId,
                                                     @RequestBody(required = false) Map<String, String> body) {
        return ResponseEntity.ok(alertManagerService.markFalsePositive(anomalyId, actor(body), note(body)));
    }

    @PostMapping("/{anomalyId}/feedback")
    @Operation(summary = "Submit feedback for an anomaly",
               description = "type is CONFIRMED, ADJUSTED or FALSE_POSITIVE")
    public ResponseEntity<?> submitFeedback(@PathVariable String anomalyId,
                                            @RequestBody Map<String, String> body) {
        String type = body.get("type");
        if (type == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "type is required"));
        }
        FeedbackType feedbackType = FeedbackType.valueOf(type.trim().toUpperCase());

        Optional<Feedback> feedback = alertManagerService.submitFeedback(anomalyId, feedbackType, actor(body), note(body));
        if (feedback.isEmpty()) {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("anomalyId", anomalyId);
            response.put("recorded", false);
            response.put("reason", "anomaly already marked FALSE_POSITIVE");
            return ResponseEntity.ok(response);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(feedback.get());
    }

    @GetMapping("/{anomalyId}/alerts")
    @Operation(summary = "List alerts raised for an anomaly")
    public ResponseEntity<List<Alert>> getAlerts(@PathVariable String anomalyId) {
        return ResponseEntity.ok(alertManagerService.alertsFor(anomalyId));
    }

    @GetMapping("/{anomalyId}/feedback")
    @Operation(summary = "List feedback recorded for an anomaly")
    public ResponseEntity<List<Feedback>> getFeedback(@PathVariable String anomalyId) {
        return ResponseEntity.ok(alertManagerService.feedbackFor(anomalyId));
    }

    private static String actor(Map<String, String> body) {
        if (body == null) return DEFAULT_ACTOR;
        String actor = body.get("actor");
        return actor == null || actor.isBlank() ? DEFAULT_ACTOR : actor;
    }

    private static String note(Map<String, String> body) {
        return body == null ? null : body.get("note");
    }
}
