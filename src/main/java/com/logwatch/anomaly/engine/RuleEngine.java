package com.logwatch.anomaly.engine;

import com.logwatch.anomaly.config.MetricsConfig;
import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.model.AnomalyStatus;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.RuleType;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs every enabled rule against a feature sample and turns hits into candidate anomalies.
 * Uses the Strategy pattern: each RuleType is handled by one registered RuleEvaluator.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final Map<RuleType, RuleEvaluator> evaluatorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public RuleEngine(List<RuleEvaluator> evaluators, Tracer tracer, MetricsConfig metricsConfig) {
        this.evaluatorMap = new EnumMap<>(RuleType.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all evaluator implementations
        for (RuleEvaluator evaluator : evaluators) {
            RuleEvaluator previous = evaluatorMap.put(evaluator.getSupportedRuleType(), evaluator);
            if (previous != null) {
                throw new IllegalStateException("Two evaluators registered for " + evaluator.getSupportedRuleType());
            }
            log.info("Registered rule evaluator: {} -> {}",
                    evaluator.getSupportedRuleType(), evaluator.getClass().getSimpleName());
        }
    }

    /**
     * Evaluate all enabled rules in rule order. Several rules may fire for the same sample.
     * A rule that throws is logged and counted and treated as not firing.
     *
     * @return candidate anomalies, not yet stored and without an id
     */
    public List<Anomaly> evaluateAll(FeatureSample sample, EvaluationContext context) {
        List<Anomaly> candidates = new ArrayList<>();

        for (RuleEvaluator evaluator : evaluatorMap.values()) {
            if (!evaluator.isEnabled()) continue;
            RuleType ruleType = evaluator.getSupportedRuleType();

            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate." + ruleType)
                    .tag("rule.id", ruleType.name())
                    .tag("service", sample.getService())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                Optional<RuleHit> hit = evaluator.evaluate(sample, context);
                ruleSpan.tag("rule.triggered", String.valueOf(hit.isPresent()));

                if (hit.isPresent()) {
                    Anomaly candidate = toCandidate(ruleType, sample, hit.get(), context.weightOf(ruleType));
                    candidates.add(candidate);
                    ruleSpan.tag("rule.score", String.valueOf(candidate.getScore()));
                    metricsConfig.recordRuleTriggered(ruleType.name());
                    log.debug("Rule {} fired for {} bucket {}: score={}",
                            ruleType, sample.getService(), sample.getBucketStart(), candidate.getScore());
                }
            } catch (Exception e) {
                ruleSpan.error(e);
                metricsConfig.recordRuleError(ruleType.name());
                log.error("Error evaluating rule {} for service {} bucket {}: {}",
                        ruleType, sample.getService(), sample.getBucketStart(), e.getMessage(), e);
            } finally {
                ruleSpan.end();
            }
        }

        return candidates;
    }

    public Collection<RuleEvaluator> getEvaluators() {
        return Collections.unmodifiableCollection(evaluatorMap.values());
    }

    public Optional<RuleEvaluator> getEvaluator(RuleType ruleType) {
        return Optional.ofNullable(evaluatorMap.get(ruleType));
    }

    private Anomaly toCandidate(RuleType ruleType, FeatureSample sample, RuleHit hit, double weight) {
        Map<String, Object> metadata = new LinkedHashMap<>(hit.getDetails());
        metadata.put("rawScore", hit.getRawScore());
        metadata.put("ruleWeight", weight);
        metadata.put("bucketStart", sample.getBucketStart());
        metadata.put("bucketEnd", sample.getBucketEnd());
        metadata.put(Anomaly.META_OCCURRENCES, 1);

        return Anomaly.builder()
                .detectedAt(sample.getBucketEnd())
                .ruleId(ruleType.name())
                .service(sample.getService())
                .severity(ruleType.getSeverity())
                .score(hit.getRawScore() * weight)
                .metadata(metadata)
                .status(AnomalyStatus.NEW)
                .build();
    }
}
