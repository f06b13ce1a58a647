package com.logwatch.anomaly.engine.evaluators;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.engine.EvaluationContext;
import com.logwatch.anomaly.engine.RuleHit;
import com.logwatch.anomaly.model.Metric;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.logwatch.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LatencyDegradationEvaluatorTest {

    private final LatencyDegradationEvaluator evaluator = new LatencyDegradationEvaluator(new EngineConfig());

    private final EvaluationContext context = EvaluationContext.builder()
            .snapshot(snapshot(baseline("checkout", Metric.P95_LATENCY, 200, 40, 3)))
            .build();

    @Test
    void evaluate_aboveRatioOfMean_fires() {
        Optional<RuleHit> hit = evaluator.evaluate(
                sample("checkout", T0).requestCount(50).p95LatencyMs(500).build(), context);

        assertThat(hit).isPresent();
        assertThat(hit.get().getRawScore()).isCloseTo(0.5, within(1e-9));
        assertThat((double) hit.get().getDetails().get("ratio")).isCloseTo(2.5, within(1e-9));
    }

    @Test
    void evaluate_exactlyAtRatio_doesNotFire() {
        assertThat(evaluator.evaluate(
                sample("checkout", T0).requestCount(50).p95LatencyMs(400).build(), context)).isEmpty();
    }

    @Test
    void evaluate_noTraffic_skipped() {
        assertThat(evaluator.evaluate(sample("checkout", T0).requestCount(0).build(), context)).isEmpty();
    }

    @Test
    void evaluate_missingBaseline_doesNotFire() {
        assertThat(evaluator.evaluate(
                sample("inventory", T0).requestCount(50).p95LatencyMs(5_000).build(), context)).isEmpty();
    }
}
