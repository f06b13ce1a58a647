package com.logwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.logwatch.anomaly.config.AerospikeConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.OptionalLong;

/**
 * Small key-value state the engine needs across restarts, chiefly the ingestion watermark.
 */
@Repository
public class EngineStateRepository {

    private static final String INGEST_KEY = "ingest";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public EngineStateRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = new WritePolicy(writePolicy);
        this.writePolicy.expiration = -1;
        this.readPolicy = readPolicy;
    }

    public OptionalLong findWatermark() {
        Key key = new Key(namespace, AerospikeConfig.SET_ENGINE_STATE, INGEST_KEY);
        Record record = client.get(readPolicy, key);
        if (record == null || record.getValue("watermark") == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(record.getLong("watermark"));
    }

    public void saveWatermark(long watermark, long updatedAt) {
        Key key = new Key(namespace, AerospikeConfig.SET_ENGINE_STATE, INGEST_KEY);
        client.put(writePolicy, key,
                new Bin("watermark", watermark),
                new Bin("updatedAt", updatedAt));
    }
}
