package com.logwatch.anomaly.engine;

import com.logwatch.anomaly.engine.isolationforest.MultivariateModel;
import com.logwatch.anomaly.model.BaselineSnapshot;
import com.logwatch.anomaly.model.RuleType;
import lombok.Builder;
import lombok.Data;

import java.util.Map;
import java.util.Optional;

/**
 * Everything a tick's evaluators read besides the sample itself. Built once per tick
 * so every sample in the tick sees the same snapshot and the same weights.
 */
@Data
@Builder
public class EvaluationContext {

    private BaselineSnapshot snapshot;

    // Feedback-derived multipliers; rules missing from the map weigh 1.0
    @Builder.Default
    private Map<RuleType, Double> ruleWeights = Map.of();

    // Multivariate models keyed by service
    @Builder.Default
    private Map<String, MultivariateModel> models = Map.of();

    public double weightOf(RuleType ruleType) {
        return ruleWeights.getOrDefault(ruleType, 1.0);
    }

    public Optional<MultivariateModel> modelFor(String service) {
        return Optional.ofNullable(models.get(service));
    }
}
