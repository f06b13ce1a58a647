package com.logwatch.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Aerospike client and shared policies. One set per collection; {@code request_events}
 * belongs to the log shipper and is only ever read.
 */
@Configuration
public class AerospikeConfig {

    public static final String SET_REQUEST_EVENTS = "request_events";
    public static final String SET_ANOMALIES = "anomalies";
    public static final String SET_BASELINES = "baselines";
    public static final String SET_BASELINE_META = "baseline_meta";
    public static final String SET_ALERTS = "alerts";
    public static final String SET_FEEDBACK = "feedback";
    public static final String SET_ENGINE_STATE = "engine_state";
    public static final String SET_MV_MODELS = "mv_models";

    private static final int SOCKET_TIMEOUT_MS = 1000;

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:logwatch}")
    private String namespace;

    @Value("${aerospike.store-timeout-ms:3000}")
    private int storeTimeoutMs;

    @Bean
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;
        // Start even when the cluster is down; the ingester reports the source as unavailable
        clientPolicy.failIfNotConnected = false;
        clientPolicy.readPolicyDefault = defaultReadPolicy();
        clientPolicy.writePolicyDefault = defaultWritePolicy();
        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        bound(policy);
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        bound(policy);
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }

    private void bound(Policy policy) {
        policy.totalTimeout = storeTimeoutMs;
        policy.socketTimeout = Math.min(SOCKET_TIMEOUT_MS, storeTimeoutMs);
    }
}
