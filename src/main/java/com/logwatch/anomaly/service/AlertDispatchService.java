package com.logwatch.anomaly.service;

import com.logwatch.anomaly.config.AlertingConfig;
import com.logwatch.anomaly.config.MetricsConfig;
import com.logwatch.anomaly.exception.DeliveryException;
import com.logwatch.anomaly.model.Alert;
import com.logwatch.anomaly.model.AlertStatus;
import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.notification.NotificationChannel;
import com.logwatch.anomaly.repository.AlertRepository;
import com.logwatch.anomaly.repository.AnomalyRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Sends alerts. Immediate alerts go out on the caller's thread; everything left
 * PENDING is picked up by the periodic flush, combined per channel where the
 * channel allows it.
 */
@Service
public class AlertDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatchService.class);

    private final Map<String, NotificationChannel> channels = new LinkedHashMap<>();
    private final AlertRepository alertRepository;
    private final AnomalyRepository anomalyRepository;
    private final AlertingConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AlertDispatchService(List<NotificationChannel> channels,
                                AlertRepository alertRepository,
                                AnomalyRepository anomalyRepository,
                                AlertingConfig config,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        for (NotificationChannel channel : channels) {
            this.channels.put(channel.name(), channel);
        }
        this.alertRepository = alertRepository;
        this.anomalyRepository = anomalyRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public List<NotificationChannel> enabledChannels() {
        return channels.values().stream().filter(NotificationChannel::isEnabled).toList();
    }

    /**
     * Send one alert right away and record the outcome on it.
     */
    public Alert deliverNow(Alert alert, Anomaly anomaly) {
        NotificationChannel channel = channels.get(alert.getChannel());
        if (channel == null) {
            alert.setStatus(AlertStatus.FAILED);
            alert.setLastError("unknown channel " + alert.getChannel());
            alertRepository.save(alert);
            return alert;
        }
        try {
            channel.send(anomaly);
            markSent(alert);
        } catch (DeliveryException e) {
            markAttemptFailed(alert, e);
        } catch (RuntimeException e) {
            log.error("Channel {} raised an unexpected error for alert {}", alert.getChannel(), alert.getAlertId(), e);
            markAttemptFailed(alert, new DeliveryException(alert.getChannel(), e.getMessage(), e));
        }
        alertRepository.save(alert);
        return alert;
    }

    @Scheduled(fixedDelayString = "${engine.alerting.batch-interval-seconds:300}",
               initialDelayString = "${engine.alerting.batch-interval-seconds:300}",
               timeUnit = TimeUnit.SECONDS)
    @Observed(name = "alerts.flush", contextualName = "flush-alert-batches")
    public int flushBatches() {
        int sent = 0;
        for (NotificationChannel channel : enabledChannels()) {
            try {
                sent += flushChannel(channel);
            } catch (Exception e) {
                log.error("Batch flush failed for channel {}", channel.name(), e);
            }
        }
        if (sent > 0) {
            log.info("Alert flush complete: {} alerts sent", sent);
        }
        return sent;
    }

    private int flushChannel(NotificationChannel channel) {
        List<Alert> pending = alertRepository.findPending(channel.name());
        if (pending.isEmpty()) return 0;

        List<Alert> deliverable = new ArrayList<>();
        List<Anomaly> anomalies = new ArrayList<>();
        for (Alert alert : pending) {
            Optional<Anomaly> anomaly = anomalyRepository.findById(alert.getAnomalyId());
            if (anomaly.isEmpty()) {
                // Anomaly expired before the alert went out
                alert.setStatus(AlertStatus.FAILED);
                alert.setLastError("anomaly no longer exists");
                alertRepository.save(alert);
                continue;
            }
            deliverable.add(alert);
            anomalies.add(anomaly.get());
        }
        if (deliverable.isEmpty()) return 0;

        if (!channel.acceptsBatches()) {
            int sent = 0;
            for (int i = 0; i < deliverable.size(); i++) {
                if (deliverNow(deliverable.get(i), anomalies.get(i)).getStatus() == AlertStatus.SENT) sent++;
            }
            return sent;
        }

        try {
            channel.sendBatch(anomalies);
            deliverable.forEach(this::markSent);
            log.info("Sent digest of {} alerts on {}", deliverable.size(), channel.name());
        } catch (DeliveryException e) {
            deliverable.forEach(alert -> markAttemptFailed(alert, e));
        } catch (RuntimeException e) {
            log.error("Channel {} raised an unexpected error sending a digest", channel.name(), e);
            DeliveryException failure = new DeliveryException(channel.name(), e.getMessage(), e);
            deliverable.forEach(alert -> markAttemptFailed(alert, failure));
        }
        deliverable.forEach(alertRepository::save);
        return (int) deliverable.stream().filter(a -> a.getStatus() == AlertStatus.SENT).count();
    }

    private void markSent(Alert alert) {
        alert.setAttempts(alert.getAttempts() + 1);
        alert.setStatus(AlertStatus.SENT);
        alert.setSentAt(clock.millis());
        alert.setLastError(null);
        metricsConfig.recordNotification(alert.getChannel(), "success");
    }

    private void markAttemptFailed(Alert alert, DeliveryException e) {
        alert.setAttempts(alert.getAttempts() + 1);
        alert.setLastError(e.getMessage());
        if (alert.getAttempts() >= config.getMaxDeliveryAttempts()) {
            alert.setStatus(AlertStatus.FAILED);
            log.warn("Alert {} on {} failed permanently after {} attempts: {}",
                    alert.getAlertId(), alert.getChannel(), alert.getAttempts(), e.getMessage());
        } else {
            alert.setStatus(AlertStatus.PENDING);
            log.warn("Alert {} on {} delivery failed (attempt {}): {}",
                    alert.getAlertId(), alert.getChannel(), alert.getAttempts(), e.getMessage());
        }
        metricsConfig.recordNotification(alert.getChannel(), "error");
    }
}
