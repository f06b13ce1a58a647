package com.logwatch.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Pager channel for critical anomalies. Never used for batched warnings.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private boolean enabled = false;
    private String accountSid;
    private String authToken;
    private String fromNumber;
    // On-call roster; every number is paged
    private List<String> onCallNumbers = new ArrayList<>();
    private String channel = "sms";  // "sms" or "whatsapp"
    // SMS segments get expensive past this
    private int maxBodyLength = 480;

    public boolean isConfigured() {
        return enabled && accountSid != null && !accountSid.isBlank()
                && fromNumber != null && !onCallNumbers.isEmpty();
    }
}
