package com.logwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.logwatch.anomaly.config.AerospikeConfig;
import com.logwatch.anomaly.model.Feedback;
import com.logwatch.anomaly.model.FeedbackType;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Append-only feedback log. Records are created once, never updated, never expire.
 */
@Repository
public class FeedbackRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy appendPolicy;

    public FeedbackRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.appendPolicy = new WritePolicy(writePolicy);
        this.appendPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        this.appendPolicy.expiration = -1;
    }

    public void append(Feedback feedback) {
        Key key = new Key(namespace, AerospikeConfig.SET_FEEDBACK, feedback.getFeedbackId());
        client.put(appendPolicy, key,
                new Bin("feedbackId", feedback.getFeedbackId()),
                new Bin("anomalyId", feedback.getAnomalyId()),
                new Bin("ruleId", feedback.getRuleId()),
                new Bin("type", feedback.getType().name()),
                new Bin("actor", feedback.getActor()),
                new Bin("createdAt", feedback.getCreatedAt()),
                new Bin("note", feedback.getNote()));
    }

    public List<Feedback> findByAnomalyId(String anomalyId) {
        List<Feedback> results = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_FEEDBACK,
                (key, record) -> {
                    if (!anomalyId.equals(record.getString("anomalyId"))) return;
                    Feedback feedback = mapRecord(record);
                    synchronized (results) {
                        results.add(feedback);
                    }
                });
        results.sort(Comparator.comparingLong(Feedback::getCreatedAt));
        return results;
    }

    /**
     * Feedback created at or after {@code since}, optionally restricted to one rule.
     */
    public List<Feedback> findSince(long since, String ruleId) {
        List<Feedback> results = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_FEEDBACK,
                (key, record) -> {
                    if (record.getLong("createdAt") < since) return;
                    if (ruleId != null && !ruleId.equals(record.getString("ruleId"))) return;
                    Feedback feedback = mapRecord(record);
                    synchronized (results) {
                        results.add(feedback);
                    }
                });
        return results;
    }

    private ScanPolicy scanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        return scanPolicy;
    }

    private Feedback mapRecord(Record record) {
        return Feedback.builder()
                .feedbackId(record.getString("feedbackId"))
                .anomalyId(record.getString("anomalyId"))
                .ruleId(record.getString("ruleId"))
                .type(FeedbackType.valueOf(record.getString("type")))
                .actor(record.getString("actor"))
                .createdAt(record.getLong("createdAt"))
                .note(record.getString("note"))
                .build();
    }
}
