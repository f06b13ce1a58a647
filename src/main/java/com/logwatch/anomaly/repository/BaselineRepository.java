package com.logwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.logwatch.anomaly.config.AerospikeConfig;
import com.logwatch.anomaly.model.Baseline;
import com.logwatch.anomaly.model.BaselineKey;
import com.logwatch.anomaly.model.BaselineSnapshot;
import com.logwatch.anomaly.model.Metric;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persists baseline snapshots: one record per (service, metric, hour, weekday) key in
 * {@code baselines}, plus a single {@code baseline_meta} record with the snapshot version
 * and the known signature and region sets. The meta record is written last, so a loaded
 * snapshot never claims a version whose baselines were not stored.
 */
@Repository
public class BaselineRepository {

    private static final Logger log = LoggerFactory.getLogger(BaselineRepository.class);
    private static final String META_KEY = "current";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public BaselineRepository(AerospikeClient client,
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

    public void save(BaselineSnapshot snapshot) {
        for (Baseline baseline : snapshot.getBaselines()) {
            Key key = new Key(namespace, AerospikeConfig.SET_BASELINES, baseline.key().asRecordKey());
            client.put(writePolicy, key,
                    new Bin("service", baseline.getService()),
                    new Bin("metric", baseline.getMetric().name()),
                    new Bin("hour", baseline.getHourOfDay()),
                    new Bin("dow", baseline.getDayOfWeek()),
                    new Bin("mean", baseline.getMean()),
                    new Bin("stdDev", baseline.getStdDev()),
                    new Bin("samples", baseline.getSampleCount()),
                    new Bin("computedAt", baseline.getComputedAt()));
        }

        Key metaKey = new Key(namespace, AerospikeConfig.SET_BASELINE_META, META_KEY);
        client.put(writePolicy, metaKey,
                new Bin("version", snapshot.getVersion()),
                new Bin("computedAt", snapshot.getComputedAt()),
                new Bin("signatures", toJson(snapshot.getKnownSignatures())),
                new Bin("regions", toJson(snapshot.getKnownRegions())));

        log.info("Persisted baseline snapshot v{} with {} keys",
                snapshot.getVersion(), snapshot.getBaselines().size());
    }

    public Optional<BaselineSnapshot> load(ZoneId zone) {
        Key metaKey = new Key(namespace, AerospikeConfig.SET_BASELINE_META, META_KEY);
        Record meta = client.get(readPolicy, metaKey);
        if (meta == null) return Optional.empty();

        Map<BaselineKey, Baseline> baselines = new HashMap<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_BASELINES,
                (key, record) -> {
                    Baseline baseline = mapRecord(record);
                    synchronized (baselines) {
                        baselines.put(baseline.key(), baseline);
                    }
                });

        return Optional.of(new BaselineSnapshot(
                meta.getLong("version"),
                meta.getLong("computedAt"),
                zone,
                baselines,
                fromJson(meta.getString("signatures")),
                fromJson(meta.getString("regions"))));
    }

    private Baseline mapRecord(Record record) {
        return Baseline.builder()
                .service(record.getString("service"))
                .metric(Metric.valueOf(record.getString("metric")))
                .hourOfDay(record.getInt("hour"))
                .dayOfWeek(record.getInt("dow"))
                .mean(record.getDouble("mean"))
                .stdDev(record.getDouble("stdDev"))
                .sampleCount(record.getLong("samples"))
                .computedAt(record.getLong("computedAt"))
                .build();
    }

    private String toJson(Map<String, Set<String>> sets) {
        try {
            return objectMapper.writeValueAsString(sets);
        } catch (Exception e) {
            log.error("Failed to serialize known sets", e);
            return "{}";
        }
    }

    private Map<String, Set<String>> fromJson(String json) {
        if (json == null || json.isEmpty()) return Map.of();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Set<String>>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize known sets", e);
            return Map.of();
        }
    }
}
