package com.logwatch.anomaly.engine.evaluators;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.engine.EvaluationContext;
import com.logwatch.anomaly.engine.RuleEvaluator;
import com.logwatch.anomaly.engine.RuleHit;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.RuleType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Feature-flagged. Fires on requests from a region outside the service's historical region set.
 */
@Component
public class GeographicAnomalyEvaluator implements RuleEvaluator {

    private final EngineConfig config;

    public GeographicAnomalyEvaluator(EngineConfig config) {
        this.config = config;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.GEOGRAPHIC_ANOMALY;
    }

    @Override
    public boolean isEnabled() {
        return config.getDetection().isGeographicRuleEnabled();
    }

    @Override
    public Optional<RuleHit> evaluate(FeatureSample sample, EvaluationContext context) {
        if (sample.getRegions().isEmpty()) {
            return Optional.empty();
        }
        Optional<Set<String>> known = context.getSnapshot().knownRegions(sample.getService());
        if (known.isEmpty()) {
            return Optional.empty();
        }

        List<String> unseen = sample.getRegions().stream()
                .filter(region -> !known.get().contains(region))
                .sorted()
                .toList();
        if (unseen.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(RuleHit.builder()
                .rawScore(unseen.size())
                .detail("observed", unseen.size())
                .detail("threshold", 0)
                .detail("newRegions", unseen)
                .build());
    }
}
