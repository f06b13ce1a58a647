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
 * Detects request volume far above or below the baseline for the hour of week.
 *
 * The two sides are configured independently (defaults +3 sigma and -2 sigma):
 * a surge is held to a stricter bar than an unusually quiet bucket.
 *
 * Example: mean=100, stdDev=10. 135 requests is 3.5 sigma above and fires
 * (threshold 130, score 5/30). 79 requests is 2.1 sigma below and fires
 * (threshold 80, score 1/20).
 */
@Component
public class VolumeAnomalyEvaluator implements RuleEvaluator {

    private final EngineConfig config;

    public VolumeAnomalyEvaluator(EngineConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.VOLUME_ANOMALY;
    }

    @Override
    public Optional<RuleHit> evaluate(FeatureSample sample, EvaluationContext context) {
        Optional<Baseline> found = context.getSnapshot()
                .find(sample.getService(), Metric.REQUEST_COUNT, sample.getBucketStart());
        if (found.isEmpty() || !found.get().isConfident(config.getBaseline().getMinSamples())) {
            return Optional.empty();
        }
        Baseline baseline = found.get();

        double observed = sample.getRequestCount();
        double mean = baseline.getMean();
        double stdDev = baseline.getStdDev();
        double upperSigma = config.getDetection().getVolumeUpperSigma();
        double lowerSigma = config.getDetection().getVolumeLowerSigma();

        double upper = mean + upperSigma * stdDev;
        double lower = mean - lowerSigma * stdDev;

        RuleHit.RuleHitBuilder hit;
        if (observed > upper) {
            double rawScore = BaselineDetails.normalizedExcess(observed - upper, upperSigma * stdDev);
            hit = BaselineDetails.hit(rawScore, baseline, observed, upper).detail("direction", "above");
        } else if (observed < lower) {
            double rawScore = BaselineDetails.normalizedExcess(lower - observed, lowerSigma * stdDev);
            hit = BaselineDetails.hit(rawScore, baseline, observed, lower).detail("direction", "below");
        } else {
            return Optional.empty();
        }

        if (stdDev > 0) {
            hit.detail("zScore", (observed - mean) / stdDev);
        }
        return Optional.of(hit.build());
    }
}
