package com.logwatch.anomaly.model;

/**
 * Drives routing: critical is pushed immediately, warning is batched,
 * info only reaches the dashboard.
 */
public enum Severity {
    CRITICAL,
    WARNING,
    INFO
}
