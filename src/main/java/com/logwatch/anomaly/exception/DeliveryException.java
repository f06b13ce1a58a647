package com.logwatch.anomaly.exception;

/**
 * A notification channel rejected the message or timed out.
 */
public class DeliveryException extends RuntimeException {

    private final String channel;

    public DeliveryException(String channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
