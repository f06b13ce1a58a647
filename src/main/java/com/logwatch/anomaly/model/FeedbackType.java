package com.logwatch.anomaly.model;

public enum FeedbackType {
    FALSE_POSITIVE,
    CONFIRMED,
    ADJUSTED
}
