package com.logwatch.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "engine.alerting")
public class AlertingConfig {
    private int groupingWindowSeconds = 300;
    private int batchIntervalSeconds = 300;
    private boolean criticalAlertImmediate = true;
    private int maxDeliveryAttempts = 5;

    // Feedback loop
    private int falsePositiveWindowDays = 30;
    private double falsePositiveRatioThreshold = 0.30;
    private double weightFloor = 0.25;
    private int ruleStatsRefreshMinutes = 15;

    private Webhook webhook = new Webhook();
    private Dashboard dashboard = new Dashboard();

    @Data
    public static class Webhook {
        private String url;
        private int connectTimeoutMs = 2000;
        private int readTimeoutMs = 5000;
    }

    @Data
    public static class Dashboard {
        private String url;
        private int timeoutMs = 3000;
    }
}
