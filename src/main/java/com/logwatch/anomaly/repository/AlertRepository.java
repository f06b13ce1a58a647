package com.logwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.logwatch.anomaly.config.AerospikeConfig;
import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.model.Alert;
import com.logwatch.anomaly.model.AlertStatus;
import com.logwatch.anomaly.model.Severity;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

@Repository
public class AlertRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AlertRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                           @Qualifier("defaultReadPolicy") Policy readPolicy,
                           EngineConfig engineConfig) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = new WritePolicy(writePolicy);
        this.writePolicy.expiration = (int) TimeUnit.DAYS.toSeconds(engineConfig.getDataRetentionDays());
        this.readPolicy = readPolicy;
    }

    public void save(Alert alert) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alert.getAlertId());
        client.put(writePolicy, key,
                new Bin("alertId", alert.getAlertId()),
                new Bin("anomalyId", alert.getAnomalyId()),
                new Bin("channel", alert.getChannel()),
                new Bin("severity", alert.getSeverity().name()),
                new Bin("batched", alert.isBatched()),
                new Bin("status", alert.getStatus().name()),
                new Bin("createdAt", alert.getCreatedAt()),
                new Bin("sentAt", alert.getSentAt()),
                new Bin("attempts", alert.getAttempts()),
                new Bin("lastError", alert.getLastError()),
                new Bin("ackAt", alert.getAcknowledgedAt()),
                new Bin("ackBy", alert.getAcknowledgedBy()));
    }

    public Optional<Alert> findById(String alertId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alertId);
        Record record = client.get(readPolicy, key);
        return record == null ? Optional.empty() : Optional.of(mapRecord(record));
    }

    public List<Alert> findByAnomalyId(String anomalyId) {
        List<Alert> results = scan(record -> anomalyId.equals(record.getString("anomalyId")));
        results.sort(Comparator.comparingLong(Alert::getCreatedAt));
        return results;
    }

    /**
     * Pending alerts for one channel, oldest first.
     */
    public List<Alert> findPending(String channel) {
        List<Alert> results = scan(record ->
                AlertStatus.PENDING.name().equals(record.getString("status"))
                        && channel.equals(record.getString("channel")));
        results.sort(Comparator.comparingLong(Alert::getCreatedAt));
        return results;
    }

    private List<Alert> scan(Predicate<Record> filter) {
        List<Alert> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERTS,
                (key, record) -> {
                    if (!filter.test(record)) return;
                    Alert alert = mapRecord(record);
                    synchronized (results) {
                        results.add(alert);
                    }
                });
        return results;
    }

    private Alert mapRecord(Record record) {
        return Alert.builder()
                .alertId(record.getString("alertId"))
                .anomalyId(record.getString("anomalyId"))
                .channel(record.getString("channel"))
                .severity(Severity.valueOf(record.getString("severity")))
                .batched(record.getBoolean("batched"))
                .status(AlertStatus.valueOf(record.getString("status")))
                .createdAt(record.getLong("createdAt"))
                .sentAt(record.getLong("sentAt"))
                .attempts(record.getInt("attempts"))
                .lastError(record.getString("lastError"))
                .acknowledgedAt(record.getLong("ackAt"))
                .acknowledgedBy(record.getString("ackBy"))
                .build();
    }
}
