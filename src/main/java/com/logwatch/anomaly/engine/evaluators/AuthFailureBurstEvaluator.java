package com.logwatch.anomaly.engine.evaluators;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.engine.EvaluationContext;
import com.logwatch.anomaly.engine.RuleEvaluator;
import com.logwatch.anomaly.engine.RuleHit;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Hard threshold: more than auth-failure-threshold 401/403 responses to a single hashed
 * source inside the sliding window. Ignores the baseline entirely.
 */
@Component
public class AuthFailureBurstEvaluator implements RuleEvaluator {

    private final EngineConfig config;

    public AuthFailureBurstEvaluator(EngineConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.AUTH_FAILURE_BURST;
    }

    @Override
    public Optional<RuleHit> evaluate(FeatureSample sample, EvaluationContext context) {
        int threshold = config.getDetection().getAuthFailureThreshold();

        String worstSource = null;
        int peak = 0;
        for (Map.Entry<String, Integer> entry : sample.getAuthFailurePeaks().entrySet()) {
            if (entry.getValue() > peak) {
                peak = entry.getValue();
                worstSource = entry.getKey();
            }
        }
        if (peak <= threshold) {
            return Optional.empty();
        }

        long offendingSources = sample.getAuthFailurePeaks().values().stream()
                .filter(count -> count > threshold)
                .count();

        return Optional.of(RuleHit.builder()
                .rawScore(BaselineDetails.normalizedExcess(peak - threshold, threshold))
                .detail("observed", peak)
                .detail("threshold", threshold)
                .detail("windowSeconds", config.getDetection().getAuthFailureWindowSeconds())
                .detail("hashedSource", worstSource)
                .detail("offendingSources", offendingSources)
                .build());
    }
}
