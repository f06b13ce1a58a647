package com.logwatch.anomaly.exception;

/**
 * The metric source could not be reached or did not answer within its timeout.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
