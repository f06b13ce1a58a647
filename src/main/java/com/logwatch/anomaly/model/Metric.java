package com.logwatch.anomaly.model;

/**
 * Numeric features that get a statistical baseline.
 */
public enum Metric {
    ERROR_RATE,
    REQUEST_COUNT,
    P95_LATENCY,
    DISTINCT_SOURCES
}
