package com.logwatch.anomaly.notification;

import com.logwatch.anomaly.config.TwilioNotificationConfig;
import com.logwatch.anomaly.exception.DeliveryException;
import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.model.Severity;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pages on-call over Twilio SMS or WhatsApp. Critical anomalies only, one message each.
 */
@Component
public class TwilioSmsNotificationChannel implements NotificationChannel {

    public static final String NAME = "sms";

    private static final Logger log = LoggerFactory.getLogger(TwilioSmsNotificationChannel.class);

    private final TwilioNotificationConfig config;

    public TwilioSmsNotificationChannel(TwilioNotificationConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        if (config.isConfigured()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio pager channel initialized. Channel: {}, on-call numbers: {}",
                    config.getChannel(), config.getOnCallNumbers().size());
        } else if (config.isEnabled()) {
            log.warn("Twilio pager channel enabled but credentials, sender or on-call numbers are missing; DISABLED.");
        } else {
            log.info("Twilio pager channel is DISABLED.");
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return config.isConfigured();
    }

    @Override
    public boolean accepts(Severity severity) {
        return severity == Severity.CRITICAL;
    }

    @Override
    public boolean acceptsBatches() {
        return false;
    }

    /**
     * Pages every on-call number. Fails if any page fails, so the alert is retried;
     * numbers already paged may then receive the page twice.
     */
    @Override
    public void send(Anomaly anomaly) {
        String body = truncate(AlertMessages.text(anomaly));
        PhoneNumber from = new PhoneNumber(resolveNumber(config.getFromNumber()));
        for (String to : config.getOnCallNumbers()) {
            try {
                Message message = Message.creator(new PhoneNumber(resolveNumber(to)), from, body).create();
                log.info("Page sent for anomaly={}, sid={}", anomaly.getAnomalyId(), message.getSid());
            } catch (RuntimeException e) {
                throw new DeliveryException(NAME, "Twilio delivery failed: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public void sendBatch(List<Anomaly> anomalies) {
        throw new UnsupportedOperationException("SMS pages are never batched");
    }

    String truncate(String body) {
        int max = config.getMaxBodyLength();
        if (body.length() <= max) return body;
        return body.substring(0, Math.max(0, max - 3)) + "...";
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
