package com.logwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One per-request sample as stored by the metric source. Only structural fields;
 * the log message itself never reaches the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawEvent {
    private long timestamp;         // epoch millis
    private String service;
    private int statusCode;
    private double latencyMs;
    private String sourceId;        // client address or other caller identifier
    private String errorSignature;  // hash of error class/shape, null on success
    private String region;

    public boolean isError() {
        return statusCode >= 500;
    }

    public boolean isAuthFailure() {
        return statusCode == 401 || statusCode == 403;
    }
}
