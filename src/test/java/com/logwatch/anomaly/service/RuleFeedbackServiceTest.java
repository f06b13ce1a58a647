package com.logwatch.anomaly.service;

import com.logwatch.anomaly.config.AlertingConfig;
import com.logwatch.anomaly.config.MetricsConfig;
import com.logwatch.anomaly.engine.RuleEngine;
import com.logwatch.anomaly.engine.RuleEvaluator;
import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.model.AnomalyStatus;
import com.logwatch.anomaly.model.Feedback;
import com.logwatch.anomaly.model.FeedbackType;
import com.logwatch.anomaly.model.RuleStats;
import com.logwatch.anomaly.model.RuleType;
import com.logwatch.anomaly.repository.AnomalyRepository;
import com.logwatch.anomaly.repository.FeedbackRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.logwatch.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RuleFeedbackServiceTest {

    @Mock private FeedbackRepository feedbackRepository;
    @Mock private AnomalyRepository anomalyRepository;
    @Mock private RuleEngine ruleEngine;
    @Mock private MetricsConfig metricsConfig;

    private AlertingConfig config;
    private RuleFeedbackService service;

    @BeforeEach
    void setUp() {
        config = new AlertingConfig();
        service = new RuleFeedbackService(feedbackRepository, anomalyRepository, ruleEngine, config,
                metricsConfig, Clock.fixed(Instant.ofEpochMilli(T0), ZoneOffset.UTC));
    }

    @Test
    void computeStats_fourOfTen_flagged() {
        RuleStats stats = RuleFeedbackService.computeStats(RuleType.VOLUME_ANOMALY,
                falsePositives(RuleType.VOLUME_ANOMALY, 4), 10, config, T0);

        assertThat(stats.getFalsePositiveRatio()).isCloseTo(0.4, within(1e-9));
        assertThat(stats.isFlaggedForReview()).isTrue();
        assertThat(stats.getWeight()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void computeStats_twoOfTen_notFlagged() {
        RuleStats stats = RuleFeedbackService.computeStats(RuleType.VOLUME_ANOMALY,
                falsePositives(RuleType.VOLUME_ANOMALY, 2), 10, config, T0);

        assertThat(stats.isFlaggedForReview()).isFalse();
        assertThat(stats.getFalsePositiveCount()).isEqualTo(2);
        assertThat(stats.getTotalRaised()).isEqualTo(10);
    }

    @Test
    void computeStats_exactlyAtThreshold_notFlagged() {
        RuleStats stats = RuleFeedbackService.computeStats(RuleType.VOLUME_ANOMALY,
                falsePositives(RuleType.VOLUME_ANOMALY, 3), 10, config, T0);

        assertThat(stats.isFlaggedForReview()).isFalse();
    }

    @Test
    void computeStats_confirmedAndDuplicateFeedbackIgnored() {
        List<Feedback> feedback = new ArrayList<>(falsePositives(RuleType.ERROR_RATE_SPIKE, 1));
        feedback.add(feedback("A-0", RuleType.ERROR_RATE_SPIKE, FeedbackType.FALSE_POSITIVE));
        feedback.add(feedback("A-7", RuleType.ERROR_RATE_SPIKE, FeedbackType.CONFIRMED));

        RuleStats stats = RuleFeedbackService.computeStats(RuleType.ERROR_RATE_SPIKE, feedback, 10, config, T0);

        assertThat(stats.getFalsePositiveCount()).isEqualTo(1);
    }

    @Test
    void computeStats_weightNeverBelowFloor() {
        RuleStats stats = RuleFeedbackService.computeStats(RuleType.NOVEL_ERROR_PATTERN,
                falsePositives(RuleType.NOVEL_ERROR_PATTERN, 10), 10, config, T0);

        assertThat(stats.getWeight()).isEqualTo(config.getWeightFloor());
    }

    @Test
    void computeStats_noHistory_fullWeight() {
        RuleStats stats = RuleFeedbackService.computeStats(RuleType.LATENCY_DEGRADATION, List.of(), 0, config, T0);

        assertThat(stats.getFalsePositiveRatio()).isZero();
        assertThat(stats.getWeight()).isEqualTo(1.0);
        assertThat(stats.isFlaggedForReview()).isFalse();
    }

    @Test
    void refreshRule_newlyFlagged_countedOnceAndWeightPublished() {
        when(feedbackRepository.findSince(anyLong(), eq("VOLUME_ANOMALY")))
                .thenReturn(falsePositives(RuleType.VOLUME_ANOMALY, 4));
        when(anomalyRepository.findByRuleSince(eq("VOLUME_ANOMALY"), anyLong())).thenReturn(raised(10));

        service.refreshRule(RuleType.VOLUME_ANOMALY);
        service.refreshRule(RuleType.VOLUME_ANOMALY);

        verify(metricsConfig, times(1)).recordRuleFlagged("VOLUME_ANOMALY");
        assertThat(service.currentWeights()).containsOnlyKeys(RuleType.VOLUME_ANOMALY);
        assertThat(service.currentWeights().get(RuleType.VOLUME_ANOMALY)).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void describe_reportsEvaluatorEnabledState() {
        RuleEvaluator geographic = mock(RuleEvaluator.class);
        when(geographic.isEnabled()).thenReturn(false);
        when(ruleEngine.getEvaluator(RuleType.GEOGRAPHIC_ANOMALY)).thenReturn(Optional.of(geographic));
        when(ruleEngine.getEvaluator(RuleType.ENGINE_SOURCE_UNAVAILABLE)).thenReturn(Optional.empty());

        assertThat(service.describe(RuleType.GEOGRAPHIC_ANOMALY).isEnabled()).isFalse();
        RuleStats engineHealth = service.describe(RuleType.ENGINE_SOURCE_UNAVAILABLE);
        assertThat(engineHealth.isEnabled()).isTrue();
        assertThat(engineHealth.getWeight()).isEqualTo(1.0);
    }

    private static List<Feedback> falsePositives(RuleType ruleType, int count) {
        List<Feedback> feedback = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            feedback.add(feedback("A-" + i, ruleType, FeedbackType.FALSE_POSITIVE));
        }
        return feedback;
    }

    private static List<Anomaly> raised(int count) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            anomalies.add(stored("A-" + i, RuleType.VOLUME_ANOMALY, "search", T0, AnomalyStatus.NEW));
        }
        return anomalies;
    }
}
