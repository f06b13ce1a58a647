package com.logwatch.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "engine")
public class EngineConfig {

    // Ingest tick period; also the width of every feature bucket.
    private int analysisIntervalSeconds = 60;

    // Upper bound on catch-up after an outage or restart.
    private int maxBacklogMinutes = 1440;

    // Replace raw source identifiers with salted hashes before they leave the ingester.
    private boolean ipHashing = true;
    private String ipHashSalt = "";

    // TTL applied to anomaly and alert records.
    private int dataRetentionDays = 30;

    // Consecutive failed ticks before an engine-health anomaly is raised.
    private int consecutiveFailureAlertThreshold = 5;

    private Baseline baseline = new Baseline();

    private Detection detection = new Detection();

    @Data
    public static class Baseline {
        private int windowDays = 7;
        private int recomputeIntervalMinutes = 60;
        // Samples per (service, metric, hour, weekday) key before sigma rules may use it.
        private long minSamples = 30;
        private String zoneId = "UTC";
    }

    @Data
    public static class Detection {
        private double sigmaThreshold = 3.0;
        private double volumeUpperSigma = 3.0;
        private double volumeLowerSigma = 2.0;
        private double latencyRatio = 2.0;
        private int authFailureThreshold = 10;
        private int authFailureWindowSeconds = 60;
        private long minRequestsForErrorRate = 0;
        private boolean geographicRuleEnabled = false;
        private Multivariate multivariate = new Multivariate();
    }

    @Data
    public static class Multivariate {
        private boolean enabled = true;
        private int retrainIntervalHours = 168;
        private int numTrees = 100;
        private int sampleSize = 256;
        private double scorePercentile = 99.0;
        private int minTrainingSamples = 100;
    }
}
