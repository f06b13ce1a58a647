package com.logwatch.anomaly.engine.evaluators;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.engine.EvaluationContext;
import com.logwatch.anomaly.engine.RuleEvaluator;
import com.logwatch.anomaly.engine.RuleHit;
import com.logwatch.anomaly.exception.RuleEvaluationException;
import com.logwatch.anomaly.model.Baseline;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.Metric;
import com.logwatch.anomaly.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects error-rate spikes against the hour-of-week baseline.
 *
 * Logic: fires when errors/requests exceeds mean + k * stdDev of the confident
 * baseline for the sample's (service, hour, weekday). Setting
 * min-requests-for-error-rate above zero skips near-idle buckets; off by default.
 *
 * Example: mean=0.02, stdDev=0.01, k=3 gives threshold 0.05. An error rate of
 * 0.0501 fires with score (0.0501-0.05)/(3*0.01) = 0.0033.
 */
@Component
public class ErrorRateSpikeEvaluator implements RuleEvaluator {

    private final EngineConfig config;

    public ErrorRateSpikeEvaluator(EngineConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.ERROR_RATE_SPIKE;
    }

    @Override
    public Optional<RuleHit> evaluate(FeatureSample sample, EvaluationContext context) {
        if (sample.getErrorCount() > sample.getRequestCount()) {
            throw new RuleEvaluationException(String.format(
                    "Error count %d exceeds request count %d for %s",
                    sample.getErrorCount(), sample.getRequestCount(), sample.getService()));
        }
        if (sample.getRequestCount() < config.getDetection().getMinRequestsForErrorRate()) {
            return Optional.empty();
        }

        Optional<Baseline> found = context.getSnapshot()
                .find(sample.getService(), Metric.ERROR_RATE, sample.getBucketStart());
        if (found.isEmpty() || !found.get().isConfident(config.getBaseline().getMinSamples())) {
            return Optional.empty();
        }
        Baseline baseline = found.get();

        double k = config.getDetection().getSigmaThreshold();
        double observed = sample.getErrorRate();
        double threshold = baseline.getMean() + k * baseline.getStdDev();
        if (observed <= threshold) {
            return Optional.empty();
        }

        double rawScore = BaselineDetails.normalizedExcess(observed - threshold, k * baseline.getStdDev());
        RuleHit.RuleHitBuilder hit = BaselineDetails.hit(rawScore, baseline, observed, threshold)
                .detail("requestCount", sample.getRequestCount())
                .detail("errorCount", sample.getErrorCount());
        if (baseline.getStdDev() > 0) {
            hit.detail("zScore", (observed - baseline.getMean()) / baseline.getStdDev());
        }
        return Optional.of(hit.build());
    }
}
