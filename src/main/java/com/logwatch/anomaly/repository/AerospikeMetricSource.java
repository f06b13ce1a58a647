package com.logwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Record;
import com.aerospike.client.exp.Exp;
import com.aerospike.client.policy.ScanPolicy;
import com.logwatch.anomaly.config.AerospikeConfig;
import com.logwatch.anomaly.exception.SourceUnavailableException;
import com.logwatch.anomaly.model.RawEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads raw request samples from the {@code request_events} set that the log shipper
 * writes into. The set is never written by the engine.
 */
@Repository
public class AerospikeMetricSource implements MetricSource {

    private static final Logger log = LoggerFactory.getLogger(AerospikeMetricSource.class);

    private final AerospikeClient client;
    private final String namespace;
    private final int timeoutMs;

    public AerospikeMetricSource(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Value("${aerospike.source-timeout-ms:5000}") int timeoutMs) {
        this.client = client;
        this.namespace = namespace;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public List<RawEvent> fetch(long fromInclusive, long toExclusive) {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.totalTimeout = timeoutMs;
        scanPolicy.socketTimeout = Math.min(timeoutMs, 1000);
        scanPolicy.filterExp = Exp.build(Exp.and(
                Exp.ge(Exp.intBin("ts"), Exp.val(fromInclusive)),
                Exp.lt(Exp.intBin("ts"), Exp.val(toExclusive))));

        List<RawEvent> events = new ArrayList<>();
        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_REQUEST_EVENTS,
                    (key, record) -> {
                        RawEvent event = mapRecord(record);
                        synchronized (events) {
                            events.add(event);
                        }
                    });
        } catch (AerospikeException e) {
            throw new SourceUnavailableException(String.format(
                    "Metric source query [%d, %d) failed: %s", fromInclusive, toExclusive, e.getMessage()), e);
        }

        log.debug("Fetched {} raw events for [{}, {})", events.size(), fromInclusive, toExclusive);
        return events;
    }

    private RawEvent mapRecord(Record record) {
        return RawEvent.builder()
                .timestamp(record.getLong("ts"))
                .service(record.getString("service"))
                .statusCode(record.getInt("status"))
                .latencyMs(asDouble(record.getValue("latencyMs")))
                .sourceId(record.getString("source"))
                .errorSignature(record.getString("errSig"))
                .region(record.getString("region"))
                .build();
    }

    // The shipper writes latency as either an integer or a float bin
    private static double asDouble(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        return 0.0;
    }
}
