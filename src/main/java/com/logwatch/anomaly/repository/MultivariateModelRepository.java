package com.logwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.logwatch.anomaly.config.AerospikeConfig;
import com.logwatch.anomaly.engine.isolationforest.IsolationForest;
import com.logwatch.anomaly.engine.isolationforest.MultivariateFeatureExtractor;
import com.logwatch.anomaly.engine.isolationforest.MultivariateModel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class MultivariateModelRepository {

    private static final Logger log = LoggerFactory.getLogger(MultivariateModelRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    // Models in service; a failed retrain leaves the previous entry untouched
    private final Map<String, MultivariateModel> modelCache = new ConcurrentHashMap<>();

    public MultivariateModelRepository(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                       @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = new WritePolicy(writePolicy);
        this.writePolicy.expiration = -1;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(MultivariateModel model) {
        String forestJson;
        String meansJson;
        try {
            forestJson = objectMapper.writeValueAsString(model.getForest());
            meansJson = objectMapper.writeValueAsString(model.getFeatureMeans());
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize model for " + model.getService(), e);
        }

        Key key = new Key(namespace, AerospikeConfig.SET_MV_MODELS, model.getService());
        client.put(writePolicy, key,
                new Bin("service", model.getService()),
                new Bin("forest", forestJson),
                new Bin("means", meansJson),
                new Bin("threshold", model.getScoreThreshold()),
                new Bin("treeCount", model.getForest().getTrees().size()),
                new Bin("trainSamples", model.getTrainingSamples()),
                new Bin("trainedAt", model.getTrainedAt()));

        modelCache.put(model.getService(), model);
        log.info("Saved multivariate model for {}: {} trees, {} samples, threshold={}",
                model.getService(), model.getForest().getTrees().size(),
                model.getTrainingSamples(), String.format("%.4f", model.getScoreThreshold()));
    }

    public Optional<MultivariateModel> load(String service) {
        MultivariateModel cached = modelCache.get(service);
        if (cached != null) return Optional.of(cached);

        Key key = new Key(namespace, AerospikeConfig.SET_MV_MODELS, service);
        Record record = client.get(readPolicy, key);
        if (record == null) return Optional.empty();

        try {
            MultivariateModel model = MultivariateModel.builder()
                    .service(service)
                    .forest(objectMapper.readValue(record.getString("forest"), IsolationForest.class))
                    .featureMeans(objectMapper.readValue(record.getString("means"), double[].class))
                    .scoreThreshold(record.getDouble("threshold"))
                    .trainingSamples(record.getInt("trainSamples"))
                    .trainedAt(record.getLong("trainedAt"))
                    .build();
            modelCache.put(service, model);
            return Optional.of(model);
        } catch (Exception e) {
            log.error("Failed to load multivariate model for {}", service, e);
            return Optional.empty();
        }
    }

    public Optional<Map<String, Object>> getModelMetadata(String service) {
        Key key = new Key(namespace, AerospikeConfig.SET_MV_MODELS, service);
        Record record = client.get(readPolicy, key);
        if (record == null) return Optional.empty();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("service", service);
        metadata.put("treeCount", record.getInt("treeCount"));
        metadata.put("featureCount", MultivariateFeatureExtractor.FEATURE_COUNT);
        metadata.put("features", MultivariateFeatureExtractor.FEATURE_NAMES);
        metadata.put("trainingSamples", record.getInt("trainSamples"));
        metadata.put("scoreThreshold", record.getDouble("threshold"));
        metadata.put("trainedAt", record.getLong("trainedAt"));
        return Optional.of(metadata);
    }
}
