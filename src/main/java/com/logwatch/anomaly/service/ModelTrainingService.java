package com.logwatch.anomaly.service;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.config.MetricsConfig;
import com.logwatch.anomaly.engine.isolationforest.IsolationForest;
import com.logwatch.anomaly.engine.isolationforest.MultivariateFeatureExtractor;
import com.logwatch.anomaly.engine.isolationforest.MultivariateModel;
import com.logwatch.anomaly.exception.ModelTrainingException;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.repository.MultivariateModelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Trains one isolation forest per service from the trailing baseline window.
 * A failed training leaves the model already in service untouched.
 */
@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    private final TrailingWindowReader windowReader;
    private final MultivariateModelRepository modelRepository;
    private final EngineConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final ZoneId zone;

    public ModelTrainingService(TrailingWindowReader windowReader,
                                MultivariateModelRepository modelRepository,
                                EngineConfig config,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.windowReader = windowReader;
        this.modelRepository = modelRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.zone = ZoneId.of(config.getBaseline().getZoneId());
    }

    @Scheduled(fixedDelayString = "${engine.detection.multivariate.retrain-interval-hours:168}",
               initialDelayString = "1",
               timeUnit = TimeUnit.HOURS)
    public void scheduledRetrain() {
        if (!config.getDetection().getMultivariate().isEnabled()) {
            return;
        }
        try {
            trainAll();
        } catch (Exception e) {
            log.warn("Scheduled model retraining failed, previous models stay in service: {}", e.getMessage());
        }
    }

    /**
     * Train a model for every service seen in the trailing window.
     *
     * @return per service, "trained" or the reason training was skipped
     */
    public Map<String, String> trainAll() {
        Map<String, List<FeatureSample>> byService = windowReader.readWindow().stream()
                .collect(Collectors.groupingBy(FeatureSample::getService, TreeMap::new, Collectors.toList()));

        Map<String, String> outcomes = new LinkedHashMap<>();
        for (Map.Entry<String, List<FeatureSample>> entry : byService.entrySet()) {
            try {
                train(entry.getKey(), entry.getValue());
                outcomes.put(entry.getKey(), "trained");
            } catch (ModelTrainingException e) {
                outcomes.put(entry.getKey(), e.getMessage());
            }
        }
        log.info("Model retraining complete: {} services, {} trained", outcomes.size(),
                outcomes.values().stream().filter("trained"::equals).count());
        return outcomes;
    }

    public MultivariateModel trainService(String service) {
        List<FeatureSample> samples = windowReader.readWindow().stream()
                .filter(s -> service.equals(s.getService()))
                .toList();
        return train(service, samples);
    }

    /**
     * @throws ModelTrainingException if there is too little history or fitting fails
     */
    public MultivariateModel train(String service, List<FeatureSample> samples) {
        EngineConfig.Multivariate settings = config.getDetection().getMultivariate();
        if (samples.size() < settings.getMinTrainingSamples()) {
            metricsConfig.recordModelTraining("skipped");
            throw new ModelTrainingException(String.format(
                    "insufficient history for %s: %d samples, need %d",
                    service, samples.size(), settings.getMinTrainingSamples()));
        }

        try {
            double[][] data = new double[samples.size()][];
            for (int i = 0; i < samples.size(); i++) {
                data[i] = MultivariateFeatureExtractor.extract(samples.get(i), zone);
            }

            IsolationForest forest = IsolationForest.fit(data, settings.getNumTrees(), settings.getSampleSize(),
                    new Random(service.hashCode()));
            double threshold = IsolationForest.percentile(forest.scoreAll(data), settings.getScorePercentile());

            MultivariateModel model = MultivariateModel.builder()
                    .service(service)
                    .forest(forest)
                    .scoreThreshold(threshold)
                    .featureMeans(MultivariateFeatureExtractor.means(data))
                    .trainingSamples(data.length)
                    .trainedAt(clock.millis())
                    .build();
            modelRepository.save(model);

            metricsConfig.recordModelTraining("success");
            return model;
        } catch (RuntimeException e) {
            metricsConfig.recordModelTraining("error");
            log.error("Model training failed for {}", service, e);
            throw new ModelTrainingException("training failed for " + service + ": " + e.getMessage(), e);
        }
    }
}
