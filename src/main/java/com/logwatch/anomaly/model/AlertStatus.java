package com.logwatch.anomaly.model;

public enum AlertStatus {
    PENDING,
    SENT,
    FAILED
}
