package com.logwatch.anomaly.engine.evaluators;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.engine.EvaluationContext;
import com.logwatch.anomaly.engine.RuleEvaluator;
import com.logwatch.anomaly.engine.RuleHit;
import com.logwatch.anomaly.engine.isolationforest.MultivariateFeatureExtractor;
import com.logwatch.anomaly.engine.isolationforest.MultivariateModel;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Scores the whole feature vector with the service's isolation forest and fires when
 * the score exceeds the percentile cut-off learned at training time. Services without
 * a trained model are skipped.
 */
@Component
public class MultivariateOutlierEvaluator implements RuleEvaluator {

    private final EngineConfig config;

    public MultivariateOutlierEvaluator(EngineConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.MULTIVARIATE_OUTLIER;
    }

    @Override
    public boolean isEnabled() {
        return config.getDetection().getMultivariate().isEnabled();
    }

    @Override
    public Optional<RuleHit> evaluate(FeatureSample sample, EvaluationContext context) {
        Optional<MultivariateModel> found = context.modelFor(sample.getService());
        if (found.isEmpty() || found.get().getForest() == null) {
            return Optional.empty();
        }
        MultivariateModel model = found.get();

        double[] features = MultivariateFeatureExtractor.extract(sample, context.getSnapshot().getZone());
        double score = model.getForest().score(features);
        double threshold = model.getScoreThreshold();
        if (score <= threshold) {
            return Optional.empty();
        }

        RuleHit.RuleHitBuilder hit = RuleHit.builder()
                .rawScore(BaselineDetails.normalizedExcess(score - threshold, 1.0 - threshold))
                .detail("observed", score)
                .detail("threshold", threshold);

        if (model.getFeatureMeans() != null) {
            double[] contributions = model.getForest().featureContributions(features, model.getFeatureMeans());
            int top = 0;
            for (int i = 1; i < contributions.length; i++) {
                if (contributions[i] > contributions[top]) top = i;
            }
            hit.detail("topFeature", MultivariateFeatureExtractor.FEATURE_NAMES[top]);
        }
        for (int i = 0; i < features.length; i++) {
            hit.detail(MultivariateFeatureExtractor.FEATURE_NAMES[i], features[i]);
        }
        return Optional.of(hit.build());
    }
}
