package com.logwatch.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger consecutiveIngestFailures;
    private final AtomicLong baselineSnapshotVersion;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.consecutiveIngestFailures = registry.gauge("ingest.consecutive_failures", new AtomicInteger(0));
        this.baselineSnapshotVersion = registry.gauge("baseline.snapshot.version", new AtomicLong(0));
    }

    public void recordIngestTick(String outcome, int bucketsProcessed) {
        Counter.builder("ingest.tick.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("ingest.backlog.buckets")
                .register(registry)
                .record(bucketsProcessed);
    }

    public void updateConsecutiveIngestFailures(int count) {
        consecutiveIngestFailures.set(count);
    }

    public void recordRuleTriggered(String ruleId) {
        Counter.builder("rule.triggered.count")
                .tag("rule_id", ruleId)
                .register(registry)
                .increment();
    }

    public void recordRuleError(String ruleId) {
        Counter.builder("rule.error.count")
                .tag("rule_id", ruleId)
                .register(registry)
                .increment();
    }

    public void recordAnomalyCreated(String severity) {
        Counter.builder("anomaly.created.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordAnomalyGrouped(String ruleId) {
        Counter.builder("anomaly.grouped.count")
                .tag("rule_id", ruleId)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordFeedback(String type) {
        Counter.builder("feedback.count")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordRuleFlagged(String ruleId) {
        Counter.builder("rule.flagged.count")
                .tag("rule_id", ruleId)
                .register(registry)
                .increment();
    }

    public void recordModelTraining(String outcome) {
        Counter.builder("model.trained.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void updateBaselineSnapshotVersion(long version) {
        baselineSnapshotVersion.set(version);
    }
}
