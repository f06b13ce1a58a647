package com.logwatch.anomaly.service;

import com.logwatch.anomaly.config.AlertingConfig;
import com.logwatch.anomaly.config.MetricsConfig;
import com.logwatch.anomaly.engine.RuleEngine;
import com.logwatch.anomaly.engine.RuleEvaluator;
import com.logwatch.anomaly.model.Feedback;
import com.logwatch.anomaly.model.FeedbackType;
import com.logwatch.anomaly.model.RuleStats;
import com.logwatch.anomaly.model.RuleType;
import com.logwatch.anomaly.repository.AnomalyRepository;
import com.logwatch.anomaly.repository.FeedbackRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Derives per-rule false-positive ratios and score weights from the feedback log.
 *
 * The table is a pure function of the trailing feedback and anomaly records; it is
 * rebuilt for one rule whenever that rule receives false-positive feedback and for
 * every rule on a schedule. Rules are flagged for review, never disabled.
 */
@Service
public class RuleFeedbackService {

    private static final Logger log = LoggerFactory.getLogger(RuleFeedbackService.class);

    private final FeedbackRepository feedbackRepository;
    private final AnomalyRepository anomalyRepository;
    private final RuleEngine ruleEngine;
    private final AlertingConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Map<RuleType, RuleStats> statsTable = new ConcurrentHashMap<>();

    public RuleFeedbackService(FeedbackRepository feedbackRepository,
                               AnomalyRepository anomalyRepository,
                               RuleEngine ruleEngine,
                               AlertingConfig config,
                               MetricsConfig metricsConfig,
                               Clock clock) {
        this.feedbackRepository = feedbackRepository;
        this.anomalyRepository = anomalyRepository;
        this.ruleEngine = ruleEngine;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${engine.alerting.rule-stats-refresh-minutes:15}",
               timeUnit = TimeUnit.MINUTES)
    public void refreshAll() {
        int flagged = 0;
        for (RuleType ruleType : RuleType.values()) {
            try {
                if (refreshRule(ruleType).isFlaggedForReview()) flagged++;
            } catch (Exception e) {
                log.warn("Failed to refresh feedback stats for rule {}: {}", ruleType, e.getMessage());
            }
        }
        log.info("Rule feedback stats refreshed. {} rules flagged for review.", flagged);
    }

    public RuleStats refreshRule(RuleType ruleType) {
        long now = clock.millis();
        long since = now - Duration.ofDays(config.getFalsePositiveWindowDays()).toMillis();

        List<Feedback> feedback = feedbackRepository.findSince(since, ruleType.name());
        int raised = anomalyRepository.findByRuleSince(ruleType.name(), since).size();

        RuleStats stats = computeStats(ruleType, feedback, raised, config, now);
        RuleStats previous = statsTable.put(ruleType, stats);

        if (stats.isFlaggedForReview() && (previous == null || !previous.isFlaggedForReview())) {
            metricsConfig.recordRuleFlagged(ruleType.name());
            log.warn("Rule {} flagged for review: {} of {} anomalies marked false positive (ratio={})",
                    ruleType, stats.getFalsePositiveCount(), stats.getTotalRaised(),
                    String.format("%.3f", stats.getFalsePositiveRatio()));
        }
        return stats;
    }

    /**
     * @param feedback feedback for this rule inside the trailing window
     * @param raised   anomalies the rule raised inside the same window
     */
    static RuleStats computeStats(RuleType ruleType, Collection<Feedback> feedback, int raised,
                                  AlertingConfig config, long now) {
        long falsePositives = feedback.stream()
                .filter(f -> f.getType() == FeedbackType.FALSE_POSITIVE)
                .map(Feedback::getAnomalyId)
                .distinct()
                .count();
        // An anomaly raised just before the window can still be dismissed inside it
        int total = Math.max(raised, (int) falsePositives);

        double ratio = total == 0 ? 0.0 : (double) falsePositives / total;
        double weight = Math.max(config.getWeightFloor(), Math.min(1.0, 1.0 - ratio));

        return RuleStats.builder()
                .ruleId(ruleType.name())
                .name(ruleType.getDisplayName())
                .severity(ruleType.getSeverity())
                .falsePositiveCount((int) falsePositives)
                .totalRaised(total)
                .falsePositiveRatio(ratio)
                .weight(weight)
                .flaggedForReview(ratio > config.getFalsePositiveRatioThreshold())
                .computedAt(now)
                .build();
    }

    public Map<RuleType, Double> currentWeights() {
        Map<RuleType, Double> weights = new EnumMap<>(RuleType.class);
        statsTable.forEach((rule, stats) -> weights.put(rule, stats.getWeight()));
        return weights;
    }

    public List<RuleStats> listRules() {
        List<RuleStats> rules = new ArrayList<>();
        for (RuleType ruleType : RuleType.values()) {
            rules.add(describe(ruleType));
        }
        return rules;
    }

    public RuleStats describe(RuleType ruleType) {
        RuleStats stats = statsTable.get(ruleType);
        RuleStats view = stats != null
                ? stats.toBuilder().build()
                : RuleStats.builder()
                        .ruleId(ruleType.name())
                        .name(ruleType.getDisplayName())
                        .severity(ruleType.getSeverity())
                        .weight(1.0)
                        .build();
        // The engine-health rule has no evaluator and is always on
        view.setEnabled(ruleEngine.getEvaluator(ruleType).map(RuleEvaluator::isEnabled).orElse(true));
        return view;
    }
}
