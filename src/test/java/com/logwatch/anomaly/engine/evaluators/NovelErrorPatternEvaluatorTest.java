package com.logwatch.anomaly.engine.evaluators;

import com.logwatch.anomaly.engine.EvaluationContext;
import com.logwatch.anomaly.engine.RuleHit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.logwatch.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class NovelErrorPatternEvaluatorTest {

    private final NovelErrorPatternEvaluator evaluator = new NovelErrorPatternEvaluator();

    private final EvaluationContext context = EvaluationContext.builder()
            .snapshot(snapshot(Map.of("orders", Set.of("sig-timeout", "sig-npe")), Map.of()))
            .build();

    @Test
    void evaluate_unseenSignature_fires() {
        Optional<RuleHit> hit = evaluator.evaluate(sample("orders", T0)
                .requestCount(100).errorCount(2)
                .errorSignature("sig-timeout")
                .errorSignature("sig-oom")
                .build(), context);

        assertThat(hit).isPresent();
        assertThat(hit.get().getDetails()).containsEntry("novelSignatures", List.of("sig-oom"));
        assertThat(hit.get().getRawScore()).isEqualTo(1.0);
    }

    @Test
    void evaluate_onlyKnownSignatures_doesNotFire() {
        assertThat(evaluator.evaluate(sample("orders", T0)
                .requestCount(100).errorCount(1)
                .errorSignature("sig-npe")
                .build(), context)).isEmpty();
    }

    @Test
    void evaluate_serviceWithoutHistory_failsOpen() {
        assertThat(evaluator.evaluate(sample("brand-new", T0)
                .requestCount(100).errorCount(1)
                .errorSignature("sig-anything")
                .build(), context)).isEmpty();
    }
}
