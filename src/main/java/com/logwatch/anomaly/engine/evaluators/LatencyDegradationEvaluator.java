package com.logwatch.anomaly.engine.evaluators;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.engine.EvaluationContext;
import com.logwatch.anomaly.engine.RuleEvaluator;
import com.logwatch.anomaly.engine.RuleHit;
import com.logwatch.anomaly.model.Baseline;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.Metric;
import com.logwatch.anomaly.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Ratio rule: fires when the bucket's p95 latency exceeds latency-ratio times the
 * baseline mean p95. Needs a baseline with data but not a confident one.
 */
@Component
public class LatencyDegradationEvaluator implements RuleEvaluator {

    private final EngineConfig config;

    public LatencyDegradationEvaluator(EngineConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.LATENCY_DEGRADATION;
    }

    @Override
    public Optional<RuleHit> evaluate(FeatureSample sample, EvaluationContext context) {
        if (sample.getRequestCount() == 0) {
            return Optional.empty();
        }
        Optional<Baseline> found = context.getSnapshot()
                .find(sample.getService(), Metric.P95_LATENCY, sample.getBucketStart());
        if (found.isEmpty() || found.get().getSampleCount() < 1 || found.get().getMean() <= 0) {
            return Optional.empty();
        }
        Baseline baseline = found.get();

        double ratio = config.getDetection().getLatencyRatio();
        double observed = sample.getP95LatencyMs();
        double threshold = ratio * baseline.getMean();
        if (observed <= threshold) {
            return Optional.empty();
        }

        double allowedRange = (ratio - 1.0) * baseline.getMean();
        double rawScore = BaselineDetails.normalizedExcess(observed - threshold, allowedRange);
        return Optional.of(BaselineDetails.hit(rawScore, baseline, observed, threshold)
                .detail("ratio", observed / baseline.getMean())
                .build());
    }
}
