package com.logwatch.anomaly.service;

import com.logwatch.anomaly.config.AlertingConfig;
import com.logwatch.anomaly.config.MetricsConfig;
import com.logwatch.anomaly.exception.AnomalyNotFoundException;
import com.logwatch.anomaly.exception.InvalidTransitionException;
import com.logwatch.anomaly.model.Alert;
import com.logwatch.anomaly.model.AlertStatus;
import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.model.AnomalyStatus;
import com.logwatch.anomaly.model.Feedback;
import com.logwatch.anomaly.model.FeedbackType;
import com.logwatch.anomaly.model.PagedResponse;
import com.logwatch.anomaly.model.RuleType;
import com.logwatch.anomaly.model.Severity;
import com.logwatch.anomaly.notification.DashboardSink;
import com.logwatch.anomaly.notification.NotificationChannel;
import com.logwatch.anomaly.repository.AlertRepository;
import com.logwatch.anomaly.repository.AnomalyRepository;
import com.logwatch.anomaly.repository.FeedbackRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns anomaly lifecycle after detection: grouping, routing, state changes and feedback intake.
 *
 * Flow for a candidate:
 * 1. Merge into an open anomaly with the same service and rule inside the grouping window, or
 * 2. Store it as NEW, emit it to the dashboard and create alerts by severity:
 *    critical on every enabled channel (sent now unless critical-alert-immediate is off),
 *    warning as pending digest entries, info on the dashboard only.
 */
@Service
public class AlertManagerService {

    private static final Logger log = LoggerFactory.getLogger(AlertManagerService.class);
    private static final int MAX_WRITE_RETRIES = 5;

    private final AnomalyRepository anomalyRepository;
    private final AlertRepository alertRepository;
    private final FeedbackRepository feedbackRepository;
    private final AlertDispatchService dispatchService;
    private final DashboardSink dashboardSink;
    private final RuleFeedbackService ruleFeedbackService;
    private final AlertingConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AlertManagerService(AnomalyRepository anomalyRepository,
                               AlertRepository alertRepository,
                               FeedbackRepository feedbackRepository,
                               AlertDispatchService dispatchService,
                               DashboardSink dashboardSink,
                               RuleFeedbackService ruleFeedbackService,
                               AlertingConfig config,
                               MetricsConfig metricsConfig,
                               Clock clock) {
        this.anomalyRepository = anomalyRepository;
        this.alertRepository = alertRepository;
        this.feedbackRepository = feedbackRepository;
        this.dispatchService = dispatchService;
        this.dashboardSink = dashboardSink;
        this.ruleFeedbackService = ruleFeedbackService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Accept a candidate from the detector. A candidate no later than the open anomaly's
     * last occurrence is treated as a replay and leaves the record untouched.
     *
     * @return the stored anomaly, either the new record or the open one it was merged into
     */
    public Anomaly submit(Anomaly candidate) {
        long windowMillis = config.getGroupingWindowSeconds() * 1000L;

        for (int attempt = 0; attempt < MAX_WRITE_RETRIES; attempt++) {
            Optional<Anomaly> open = anomalyRepository.findLatestOpen(candidate.getService(), candidate.getRuleId());
            if (open.isEmpty() || Math.abs(candidate.getDetectedAt() - open.get().getDetectedAt()) > windowMillis) {
                return store(candidate);
            }

            Anomaly existing = open.get();
            if (candidate.getDetectedAt() <= lastSeenAt(existing)) {
                // bucket replayed after a failed tick; this observation is already counted
                log.debug("Candidate {} for {} at {} already grouped into anomaly {}",
                        candidate.getRuleId(), candidate.getService(), candidate.getDetectedAt(),
                        existing.getAnomalyId());
                return existing;
            }
            mergeInto(existing, candidate);
            if (anomalyRepository.update(existing)) {
                metricsConfig.recordAnomalyGrouped(existing.getRuleId());
                log.debug("Grouped {} candidate for {} into anomaly {} (occurrences={})",
                        candidate.getRuleId(), candidate.getService(), existing.getAnomalyId(),
                        existing.getOccurrences());
                return existing;
            }
        }
        throw new IllegalStateException(String.format(
                "Could not group %s candidate for %s after %d attempts",
                candidate.getRuleId(), candidate.getService(), MAX_WRITE_RETRIES));
    }

    private void mergeInto(Anomaly existing, Anomaly candidate) {
        existing.getMetadata().put(Anomaly.META_OCCURRENCES, existing.getOccurrences() + 1);
        long lastSeen = Math.max(candidate.getDetectedAt(), lastSeenAt(existing));
        existing.getMetadata().put(Anomaly.META_LAST_SEEN_AT, lastSeen);
        double peak = Math.max(peakScore(existing), candidate.getScore());
        existing.getMetadata().put(Anomaly.META_PEAK_SCORE, peak);
    }

    private Anomaly store(Anomaly candidate) {
        Anomaly anomaly = candidate.toBuilder()
                .anomalyId(UUID.randomUUID().toString())
                .status(AnomalyStatus.NEW)
                .build();
        anomaly.getMetadata().put(Anomaly.META_LAST_SEEN_AT, anomaly.getDetectedAt());
        anomaly.getMetadata().put(Anomaly.META_PEAK_SCORE, anomaly.getScore());
        anomalyRepository.insert(anomaly);

        metricsConfig.recordAnomalyCreated(anomaly.getSeverity().name());
        log.info("Anomaly {} created: rule={} service={} severity={} score={}",
                anomaly.getAnomalyId(), anomaly.getRuleId(), anomaly.getService(),
                anomaly.getSeverity(), String.format("%.4f", anomaly.getScore()));

        route(anomaly);
        return anomaly;
    }

    private void route(Anomaly anomaly) {
        dashboardSink.emit(anomaly);

        Severity severity = anomaly.getSeverity();
        if (severity == Severity.INFO) {
            return;
        }

        boolean immediate = severity == Severity.CRITICAL && config.isCriticalAlertImmediate();
        for (NotificationChannel channel : dispatchService.enabledChannels()) {
            if (!channel.accepts(severity)) continue;
            // Warnings only travel in digests
            if (severity == Severity.WARNING && !channel.acceptsBatches()) continue;

            Alert alert = Alert.builder()
                    .alertId(UUID.randomUUID().toString())
                    .anomalyId(anomaly.getAnomalyId())
                    .channel(channel.name())
                    .severity(severity)
                    .batched(!immediate)
                    .status(AlertStatus.PENDING)
                    .createdAt(clock.millis())
                    .build();
            alertRepository.save(alert);

            if (immediate) {
                dispatchService.deliverNow(alert, anomaly);
            }
        }
    }

    public Anomaly acknowledge(String anomalyId, String actor, String note) {
        return transition(anomalyId, AnomalyStatus.ACKNOWLEDGED, actor, note);
    }

    public Anomaly resolve(String anomalyId, String actor, String note) {
        return transition(anomalyId, AnomalyStatus.RESOLVED, actor, note);
    }

    public Anomaly markFalsePositive(String anomalyId, String actor, String note) {
        return transition(anomalyId, AnomalyStatus.FALSE_POSITIVE, actor, note);
    }

    /**
     * Move an anomaly to {@code target}. Repeating a transition the anomaly already made is a
     * no-op that returns the current record without side effects.
     *
     * @throws AnomalyNotFoundException    if no such anomaly exists
     * @throws InvalidTransitionException if the state machine forbids the change
     */
    public Anomaly transition(String anomalyId, AnomalyStatus target, String actor, String note) {
        return applyTransition(anomalyId, target, actor, note).anomaly();
    }

    /**
     * Record a human judgment. False-positive feedback goes through the state machine
     * so it both dismisses the anomaly and feeds the rule's ratio.
     *
     * @return the appended feedback, or empty when the anomaly was already dismissed
     */
    public Optional<Feedback> submitFeedback(String anomalyId, FeedbackType type, String actor, String note) {
        if (type == FeedbackType.FALSE_POSITIVE) {
            return applyTransition(anomalyId, AnomalyStatus.FALSE_POSITIVE, actor, note).feedback();
        }
        Anomaly anomaly = getAnomaly(anomalyId);
        return Optional.of(appendFeedback(anomaly, type, actor, note, clock.millis()));
    }

    private Transitioned applyTransition(String anomalyId, AnomalyStatus target, String actor, String note) {
        for (int attempt = 0; attempt < MAX_WRITE_RETRIES; attempt++) {
            Anomaly anomaly = getAnomaly(anomalyId);
            AnomalyStatus from = anomaly.getStatus();
            if (from == target) {
                log.debug("Anomaly {} already {}; nothing to do", anomalyId, target);
                return new Transitioned(anomaly, Optional.empty());
            }
            if (!from.canTransitionTo(target)) {
                throw new InvalidTransitionException(anomalyId, from, target);
            }

            long now = clock.millis();
            anomaly.setStatus(target);
            switch (target) {
                case ACKNOWLEDGED -> {
                    anomaly.setAcknowledgedAt(now);
                    anomaly.setAcknowledgedBy(actor);
                }
                case RESOLVED -> {
                    anomaly.setResolvedAt(now);
                    anomaly.setResolvedBy(actor);
                }
                case FALSE_POSITIVE -> {
                    anomaly.setFalsePositive(true);
                    anomaly.setResolvedAt(now);
                    anomaly.setResolvedBy(actor);
                }
                default -> throw new InvalidTransitionException(anomalyId, from, target);
            }
            if (note != null && !note.isBlank()) {
                anomaly.getMetadata().put("statusNote", note);
            }

            if (!anomalyRepository.update(anomaly)) {
                continue;
            }

            log.info("Anomaly {} moved {} -> {} by {}", anomalyId, from, target, actor);
            return new Transitioned(anomaly, afterTransition(anomaly, target, actor, note, now));
        }
        throw new IllegalStateException("Concurrent updates kept winning for anomaly " + anomalyId);
    }

    private Optional<Feedback> afterTransition(Anomaly anomaly, AnomalyStatus target,
                                               String actor, String note, long now) {
        Optional<Feedback> feedback = Optional.empty();
        if (target == AnomalyStatus.ACKNOWLEDGED) {
            for (Alert alert : alertRepository.findByAnomalyId(anomaly.getAnomalyId())) {
                alert.setAcknowledgedAt(now);
                alert.setAcknowledgedBy(actor);
                alertRepository.save(alert);
            }
        }
        if (target == AnomalyStatus.FALSE_POSITIVE) {
            feedback = Optional.of(appendFeedback(anomaly, FeedbackType.FALSE_POSITIVE, actor, note, now));
            try {
                ruleFeedbackService.refreshRule(RuleType.fromId(anomaly.getRuleId()));
            } catch (Exception e) {
                log.warn("Rule stats refresh after false positive on {} failed: {}",
                        anomaly.getAnomalyId(), e.getMessage());
            }
        }
        dashboardSink.emit(anomaly);
        return feedback;
    }

    private Feedback appendFeedback(Anomaly anomaly, FeedbackType type, String actor, String note, long now) {
        Feedback feedback = Feedback.builder()
                .feedbackId(UUID.randomUUID().toString())
                .anomalyId(anomaly.getAnomalyId())
                .ruleId(anomaly.getRuleId())
                .type(type)
                .actor(actor)
                .createdAt(now)
                .note(note)
                .build();
        feedbackRepository.append(feedback);
        metricsConfig.recordFeedback(type.name());
        log.info("Feedback {} recorded for anomaly {} by {}", type, anomaly.getAnomalyId(), actor);
        return feedback;
    }

    public Anomaly getAnomaly(String anomalyId) {
        return anomalyRepository.findById(anomalyId)
                .orElseThrow(() -> new AnomalyNotFoundException(anomalyId));
    }

    public PagedResponse<Anomaly> search(Long from, Long to, String service, AnomalyStatus status,
                                         Severity severity, String ruleId, int limit, Long before) {
        return anomalyRepository.findByFilters(from, to, service, status, severity, ruleId, limit, before);
    }

    public List<Alert> alertsFor(String anomalyId) {
        getAnomaly(anomalyId);
        return alertRepository.findByAnomalyId(anomalyId);
    }

    public List<Feedback> feedbackFor(String anomalyId) {
        getAnomaly(anomalyId);
        return feedbackRepository.findByAnomalyId(anomalyId);
    }

    private static long lastSeenAt(Anomaly anomaly) {
        Object value = anomaly.getMetadata().get(Anomaly.META_LAST_SEEN_AT);
        return value instanceof Number n ? n.longValue() : anomaly.getDetectedAt();
    }

    private static double peakScore(Anomaly anomaly) {
        Object value = anomaly.getMetadata().get(Anomaly.META_PEAK_SCORE);
        return value instanceof Number n ? n.doubleValue() : anomaly.getScore();
    }

    private record Transitioned(Anomaly anomaly, Optional<Feedback> feedback) {}
}
