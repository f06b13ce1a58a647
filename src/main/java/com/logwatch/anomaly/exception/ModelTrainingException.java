package com.logwatch.anomaly.exception;

public class ModelTrainingException extends RuntimeException {

    public ModelTrainingException(String message) {
        super(message);
    }

    public ModelTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
