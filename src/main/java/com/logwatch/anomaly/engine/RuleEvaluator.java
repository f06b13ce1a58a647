package com.logwatch.anomaly.engine;

import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.RuleType;

import java.util.Optional;

/**
 * Interface for all detection rules.
 * Each implementation handles exactly one RuleType.
 */
public interface RuleEvaluator {

    /**
     * The rule type this evaluator handles.
     */
    RuleType getSupportedRuleType();

    /**
     * Whether the rule runs at all. Feature-flagged rules override this.
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Evaluate one feature sample.
     *
     * @param sample  the aggregated bucket for one service
     * @param context baseline snapshot, rule weights and models in force for this tick
     * @return a hit when the rule fires, empty otherwise
     */
    Optional<RuleHit> evaluate(FeatureSample sample, EvaluationContext context);
}
