package com.logwatch.anomaly.controller;

import com.logwatch.anomaly.config.AlertingConfig;
import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.config.TwilioNotificationConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "Effective engine configuration (read-only)")
public class ConfigController {

    private final EngineConfig engineConfig;
    private final AlertingConfig alertingConfig;
    private final TwilioNotificationConfig twilioConfig;

    public ConfigController(EngineConfig engineConfig,
                            AlertingConfig alertingConfig,
                            TwilioNotificationConfig twilioConfig) {
        this.engineConfig = engineConfig;
        this.alertingConfig = alertingConfig;
        this.twilioConfig = twilioConfig;
    }

    @Operation(summary = "Get effective configuration",
            description = "Secrets (hash salt, Twilio credentials) are never returned")
    @GetMapping
    public ResponseEntity<Map<String, Object>> getConfig() {
        Map<String, Object> engine = new LinkedHashMap<>();
        engine.put("analysisIntervalSeconds", engineConfig.getAnalysisIntervalSeconds());
        engine.put("maxBacklogMinutes", engineConfig.getMaxBacklogMinutes());
        engine.put("ipHashing", engineConfig.isIpHashing());
        engine.put("dataRetentionDays", engineConfig.getDataRetentionDays());
        engine.put("consecutiveFailureAlertThreshold", engineConfig.getConsecutiveFailureAlertThreshold());
        engine.put("baseline", engineConfig.getBaseline());
        engine.put("detection", engineConfig.getDetection());

        Map<String, Object> alerting = new LinkedHashMap<>();
        alerting.put("groupingWindowSeconds", alertingConfig.getGroupingWindowSeconds());
        alerting.put("batchIntervalSeconds", alertingConfig.getBatchIntervalSeconds());
        alerting.put("criticalAlertImmediate", alertingConfig.isCriticalAlertImmediate());
        alerting.put("maxDeliveryAttempts", alertingConfig.getMaxDeliveryAttempts());
        alerting.put("falsePositiveWindowDays", alertingConfig.getFalsePositiveWindowDays());
        alerting.put("falsePositiveRatioThreshold", alertingConfig.getFalsePositiveRatioThreshold());
        alerting.put("weightFloor", alertingConfig.getWeightFloor());
        alerting.put("webhookConfigured", alertingConfig.getWebhook().getUrl() != null
                && !alertingConfig.getWebhook().getUrl().isBlank());
        alerting.put("dashboardConfigured", alertingConfig.getDashboard().getUrl() != null
                && !alertingConfig.getDashboard().getUrl().isBlank());
        alerting.put("smsEnabled", twilioConfig.isConfigured());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("engine", engine);
        response.put("alerting", alerting);
        return ResponseEntity.ok(response);
    }
}
