package com.logwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.logwatch.anomaly.config.AerospikeConfig;
import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.model.AnomalyStatus;
import com.logwatch.anomaly.model.PagedResponse;
import com.logwatch.anomaly.model.Severity;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@Repository
public class AnomalyRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final WritePolicy createPolicy;
    private final WritePolicy updatePolicy;
    private final ObjectMapper objectMapper;

    public AnomalyRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy,
                             EngineConfig engineConfig) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        int ttlSeconds = (int) TimeUnit.DAYS.toSeconds(engineConfig.getDataRetentionDays());

        this.createPolicy = new WritePolicy(writePolicy);
        this.createPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        this.createPolicy.expiration = ttlSeconds;

        this.updatePolicy = new WritePolicy(writePolicy);
        this.updatePolicy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        this.updatePolicy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        this.updatePolicy.expiration = ttlSeconds;

        this.objectMapper = new ObjectMapper();
    }

    public void insert(Anomaly anomaly) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomaly.getAnomalyId());
        client.put(createPolicy, key, toBins(anomaly));
        anomaly.setGeneration(1);
    }

    /**
     * Compare-and-set write: succeeds only if the record still has the generation
     * the anomaly was read with.
     *
     * @return false when another writer got there first; the caller should re-read and retry
     */
    public boolean update(Anomaly anomaly) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomaly.getAnomalyId());
        WritePolicy policy = new WritePolicy(updatePolicy);
        policy.generation = anomaly.getGeneration();
        try {
            client.put(policy, key, toBins(anomaly));
            anomaly.setGeneration(anomaly.getGeneration() + 1);
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Generation mismatch updating anomaly {}", anomaly.getAnomalyId());
                return false;
            }
            throw e;
        }
    }

    public Optional<Anomaly> findById(String anomalyId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomalyId);
        Record record = client.get(readPolicy, key);
        if (record == null) return Optional.empty();
        return Optional.of(mapRecord(record));
    }

    /**
     * Most recent open (new or acknowledged) anomaly for the service and rule, if any.
     */
    public Optional<Anomaly> findLatestOpen(String service, String ruleId) {
        List<Anomaly> matches = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    if (!service.equals(record.getString("service"))) return;
                    if (!ruleId.equals(record.getString("ruleId"))) return;
                    if (AnomalyStatus.valueOf(record.getString("status")).isTerminal()) return;
                    Anomaly anomaly = mapRecord(record);
                    synchronized (matches) {
                        matches.add(anomaly);
                    }
                });
        return matches.stream().max(Comparator.comparingLong(Anomaly::getDetectedAt));
    }

    public List<Anomaly> findByRuleSince(String ruleId, long since) {
        List<Anomaly> results = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    if (!ruleId.equals(record.getString("ruleId"))) return;
                    if (record.getLong("detectedAt") < since) return;
                    Anomaly anomaly = mapRecord(record);
                    synchronized (results) {
                        results.add(anomaly);
                    }
                });
        return results;
    }

    public PagedResponse<Anomaly> findByFilters(Long from, Long to, String service,
                                                AnomalyStatus status, Severity severity,
                                                String ruleId, int limit, Long before) {
        List<Anomaly> results = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    try {
                        long detectedAt = record.getLong("detectedAt");
                        if (before != null && detectedAt >= before) return;
                        if (from != null && detectedAt < from) return;
                        if (to != null && detectedAt > to) return;
                        if (service != null && !service.isEmpty()
                                && !service.equals(record.getString("service"))) return;
                        if (ruleId != null && !ruleId.isEmpty()
                                && !ruleId.equalsIgnoreCase(record.getString("ruleId"))) return;
                        if (status != null && !status.name().equals(record.getString("status"))) return;
                        if (severity != null && !severity.name().equals(record.getString("severity"))) return;

                        Anomaly anomaly = mapRecord(record);
                        synchronized (results) {
                            results.add(anomaly);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to filter anomaly record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(Anomaly::getDetectedAt).reversed());
        return PagedResponse.of(results, limit, a -> String.valueOf(a.getDetectedAt()));
    }

    private ScanPolicy scanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        return scanPolicy;
    }

    private Bin[] toBins(Anomaly anomaly) {
        return new Bin[]{
                new Bin("anomalyId", anomaly.getAnomalyId()),
                new Bin("detectedAt", anomaly.getDetectedAt()),
                new Bin("ruleId", anomaly.getRuleId()),
                new Bin("service", anomaly.getService()),
                new Bin("severity", anomaly.getSeverity().name()),
                new Bin("score", anomaly.getScore()),
                new Bin("metadata", serializeMetadata(anomaly.getMetadata())),
                new Bin("status", anomaly.getStatus().name()),
                new Bin("ackAt", anomaly.getAcknowledgedAt()),
                new Bin("ackBy", anomaly.getAcknowledgedBy()),
                new Bin("resolvedAt", anomaly.getResolvedAt()),
                new Bin("resolvedBy", anomaly.getResolvedBy()),
                new Bin("falsePositive", anomaly.isFalsePositive())
        };
    }

    private Anomaly mapRecord(Record record) {
        return Anomaly.builder()
                .anomalyId(record.getString("anomalyId"))
                .detectedAt(record.getLong("detectedAt"))
                .ruleId(record.getString("ruleId"))
                .service(record.getString("service"))
                .severity(Severity.valueOf(record.getString("severity")))
                .score(record.getDouble("score"))
                .metadata(deserializeMetadata(record.getString("metadata")))
                .status(AnomalyStatus.valueOf(record.getString("status")))
                .acknowledgedAt(record.getLong("ackAt"))
                .acknowledgedBy(record.getString("ackBy"))
                .resolvedAt(record.getLong("resolvedAt"))
                .resolvedBy(record.getString("resolvedBy"))
                .falsePositive(record.getBoolean("falsePositive"))
                .generation(record.generation)
                .build();
    }

    private String serializeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (Exception e) {
            log.error("Failed to serialize anomaly metadata", e);
            return "{}";
        }
    }

    private Map<String, Object> deserializeMetadata(String json) {
        if (json == null || json.isEmpty()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize anomaly metadata", e);
            return new LinkedHashMap<>();
        }
    }
}
