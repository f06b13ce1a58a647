package com.logwatch.anomaly.engine.evaluators;

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
 * Fires when the bucket contains an error signature that never appeared during the
 * baseline window. A service with no recorded signature set is skipped.
 */
@Component
public class NovelErrorPatternEvaluator implements RuleEvaluator {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.NOVEL_ERROR_PATTERN;
    }

    @Override
    public Optional<RuleHit> evaluate(FeatureSample sample, EvaluationContext context) {
        if (sample.getErrorSignatures().isEmpty()) {
            return Optional.empty();
        }
        Optional<Set<String>> known = context.getSnapshot().knownSignatures(sample.getService());
        if (known.isEmpty()) {
            return Optional.empty();
        }

        List<String> novel = sample.getErrorSignatures().stream()
                .filter(signature -> !known.get().contains(signature))
                .sorted()
                .toList();
        if (novel.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(RuleHit.builder()
                .rawScore(novel.size())
                .detail("observed", novel.size())
                .detail("threshold", 0)
                .detail("novelSignatures", novel)
                .detail("knownSignatureCount", known.get().size())
                .build());
    }
}
