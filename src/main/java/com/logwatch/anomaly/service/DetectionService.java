package com.logwatch.anomaly.service;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.engine.EvaluationContext;
import com.logwatch.anomaly.engine.RuleEngine;
import com.logwatch.anomaly.engine.isolationforest.MultivariateModel;
import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.model.BaselineSnapshot;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.Metric;
import com.logwatch.anomaly.repository.MultivariateModelRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the detector over one bucket's samples and hands every candidate to the alert manager.
 *
 * Flow:
 * 1. Pin the current baseline snapshot, rule weights and multivariate models for the batch
 * 2. Evaluate every enabled rule per sample via the RuleEngine
 * 3. Submit candidates to the AlertManagerService for grouping and routing
 */
@Service
public class DetectionService {

    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    private final RuleEngine ruleEngine;
    private final BaselineService baselineService;
    private final RuleFeedbackService ruleFeedbackService;
    private final MultivariateModelRepository modelRepository;
    private final AlertManagerService alertManagerService;
    private final EngineConfig config;

    public DetectionService(RuleEngine ruleEngine,
                            BaselineService baselineService,
                            RuleFeedbackService ruleFeedbackService,
                            MultivariateModelRepository modelRepository,
                            AlertManagerService alertManagerService,
                            EngineConfig config) {
        this.ruleEngine = ruleEngine;
        this.baselineService = baselineService;
        this.ruleFeedbackService = ruleFeedbackService;
        this.modelRepository = modelRepository;
        this.alertManagerService = alertManagerService;
        this.config = config;
    }

    /**
     * Services that hold a request-count baseline but sent nothing in the bucket are
     * evaluated as quiet samples, so a full outage still reaches the volume rule.
     *
     * @param samples one sample per service that had traffic in {@code [bucketStart, bucketEnd)}
     * @return the anomalies stored or updated for this bucket
     */
    @Observed(name = "detection.evaluate", contextualName = "detect-bucket")
    public List<Anomaly> detect(long bucketStart, long bucketEnd, List<FeatureSample> samples) {
        BaselineSnapshot snapshot = baselineService.current();
        List<FeatureSample> batch = withQuietServices(snapshot, bucketStart, bucketEnd, samples);
        if (batch.isEmpty()) return List.of();

        EvaluationContext context = EvaluationContext.builder()
                .snapshot(snapshot)
                .ruleWeights(ruleFeedbackService.currentWeights())
                .models(loadModels(batch))
                .build();

        List<Anomaly> results = new ArrayList<>();
        for (FeatureSample sample : batch) {
            for (Anomaly candidate : ruleEngine.evaluateAll(sample, context)) {
                results.add(alertManagerService.submit(candidate));
            }
        }

        if (!results.isEmpty()) {
            log.info("Bucket {} produced {} anomalies across {} services ({} quiet)",
                    bucketStart, results.size(), batch.size(), batch.size() - samples.size());
        }
        return results;
    }

    private static List<FeatureSample> withQuietServices(BaselineSnapshot snapshot, long bucketStart,
                                                         long bucketEnd, List<FeatureSample> samples) {
        Set<String> reporting = new HashSet<>();
        for (FeatureSample sample : samples) {
            reporting.add(sample.getService());
        }
        List<FeatureSample> batch = new ArrayList<>(samples);
        for (String service : snapshot.servicesWith(Metric.REQUEST_COUNT)) {
            if (!reporting.contains(service)) {
                batch.add(FeatureSample.quiet(service, bucketStart, bucketEnd));
            }
        }
        return batch;
    }

    private Map<String, MultivariateModel> loadModels(List<FeatureSample> samples) {
        Map<String, MultivariateModel> models = new HashMap<>();
        if (!config.getDetection().getMultivariate().isEnabled()) {
            return models;
        }
        for (FeatureSample sample : samples) {
            if (models.containsKey(sample.getService())) continue;
            try {
                modelRepository.load(sample.getService()).ifPresent(m -> models.put(sample.getService(), m));
            } catch (Exception e) {
                log.warn("Could not load multivariate model for {}: {}", sample.getService(), e.getMessage());
            }
        }
        return models;
    }
}
