package com.logwatch.anomaly.notification;

import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.model.RuleType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Message bodies shared by the channels.
 */
final class AlertMessages {

    private AlertMessages() {}

    static String text(Anomaly anomaly) {
        return String.format(
                "[%s] %s on %s\n" +
                "Detected: %s\n" +
                "Score: %.2f\n" +
                "Anomaly ID: %s",
                anomaly.getSeverity(),
                displayName(anomaly.getRuleId()),
                anomaly.getService(),
                Instant.ofEpochMilli(anomaly.getDetectedAt()),
                anomaly.getScore(),
                anomaly.getAnomalyId());
    }

    static Map<String, Object> payload(Anomaly anomaly) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("anomalyId", anomaly.getAnomalyId());
        payload.put("ruleId", anomaly.getRuleId());
        payload.put("service", anomaly.getService());
        payload.put("severity", anomaly.getSeverity().name());
        payload.put("score", anomaly.getScore());
        payload.put("detectedAt", anomaly.getDetectedAt());
        payload.put("status", anomaly.getStatus().name());
        payload.put("metadata", anomaly.getMetadata());
        payload.put("text", text(anomaly));
        return payload;
    }

    static Map<String, Object> batchPayload(List<Anomaly> anomalies) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "batch");
        payload.put("count", anomalies.size());
        payload.put("anomalies", anomalies.stream().map(AlertMessages::payload).toList());
        payload.put("text", String.format("%d anomalies since the last digest", anomalies.size()));
        return payload;
    }

    private static String displayName(String ruleId) {
        try {
            return RuleType.fromId(ruleId).getDisplayName();
        } catch (IllegalArgumentException e) {
            return ruleId;
        }
    }
}
