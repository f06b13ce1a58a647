package com.logwatch.anomaly.exception;

public class AnomalyNotFoundException extends RuntimeException {

    public AnomalyNotFoundException(String anomalyId) {
        super("Anomaly not found: " + anomalyId);
    }
}
