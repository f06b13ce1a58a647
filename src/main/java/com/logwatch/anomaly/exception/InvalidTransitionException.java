package com.logwatch.anomaly.exception;

import com.logwatch.anomaly.model.AnomalyStatus;

public class InvalidTransitionException extends RuntimeException {

    public InvalidTransitionException(String anomalyId, AnomalyStatus from, AnomalyStatus to) {
        super(String.format("Anomaly %s cannot move from %s to %s", anomalyId, from, to));
    }
}
