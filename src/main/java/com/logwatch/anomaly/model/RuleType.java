package com.logwatch.anomaly.model;

/**
 * Closed set of detection rules. Each value has exactly one evaluator and a fixed severity.
 */
public enum RuleType {
    ERROR_RATE_SPIKE("Error-rate spike", Severity.CRITICAL),
    VOLUME_ANOMALY("Volume anomaly", Severity.WARNING),
    LATENCY_DEGRADATION("Latency degradation", Severity.WARNING),
    AUTH_FAILURE_BURST("Auth-failure burst", Severity.CRITICAL),
    NOVEL_ERROR_PATTERN("Novel error pattern", Severity.WARNING),
    GEOGRAPHIC_ANOMALY("Geographic anomaly", Severity.INFO),
    MULTIVARIATE_OUTLIER("Multivariate outlier", Severity.INFO),
    // Raised by the engine itself when the metric source stays unreachable
    ENGINE_SOURCE_UNAVAILABLE("Metric source unavailable", Severity.CRITICAL);

    private final String displayName;
    private final Severity severity;

    RuleType(String displayName, Severity severity) {
        this.displayName = displayName;
        this.severity = severity;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Severity getSeverity() {
        return severity;
    }

    public static RuleType fromId(String ruleId) {
        if (ruleId == null) {
            throw new IllegalArgumentException("ruleId is required");
        }
        return RuleType.valueOf(ruleId.trim().toUpperCase());
    }
}
