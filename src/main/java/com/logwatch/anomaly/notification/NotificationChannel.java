package com.logwatch.anomaly.notification;

import com.logwatch.anomaly.exception.DeliveryException;
import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.model.Severity;

import java.util.List;

/**
 * An outbound alert destination.
 */
public interface NotificationChannel {

    /** Stable name stored on every alert routed to this channel. */
    String name();

    boolean isEnabled();

    /** Whether the channel takes a routed anomaly of this severity at all. */
    boolean accepts(Severity severity);

    /** Whether pending alerts may be combined into one message on flush. */
    boolean acceptsBatches();

    void send(Anomaly anomaly) throws DeliveryException;

    /**
     * Deliver several anomalies as one combined message. Only called when
     * {@link #acceptsBatches()} is true.
     */
    void sendBatch(List<Anomaly> anomalies) throws DeliveryException;
}
