package com.logwatch.anomaly.engine.isolationforest;

import com.logwatch.anomaly.model.FeatureSample;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Turns a feature sample into the vector the per-service isolation forest scores.
 *
 * Features:
 *   [0] request count
 *   [1] error rate
 *   [2] p95 latency (ms)
 *   [3] distinct sources
 *   [4] peak auth failures from one source
 *   [5] hour of day / 24, in the baseline zone
 */
public final class MultivariateFeatureExtractor {

    public static final int FEATURE_COUNT = 6;

    public static final String[] FEATURE_NAMES = {
            "requestCount",
            "errorRate",
            "p95LatencyMs",
            "distinctSources",
            "peakAuthFailures",
            "hourOfDay"
    };

    private MultivariateFeatureExtractor() {}

    public static double[] extract(FeatureSample sample, ZoneId zone) {
        double[] features = new double[FEATURE_COUNT];
        features[0] = sample.getRequestCount();
        features[1] = sample.getErrorRate();
        features[2] = sample.getP95LatencyMs();
        features[3] = sample.getDistinctSourceCount();
        features[4] = sample.getPeakAuthFailures();
        features[5] = Instant.ofEpochMilli(sample.getBucketStart()).atZone(zone).getHour() / 24.0;
        return features;
    }

    public static double[] means(double[][] rows) {
        double[] means = new double[FEATURE_COUNT];
        if (rows.length == 0) return means;
        for (double[] row : rows) {
            for (int i = 0; i < FEATURE_COUNT; i++) {
                means[i] += row[i];
            }
        }
        for (int i = 0; i < FEATURE_COUNT; i++) {
            means[i] /= rows.length;
        }
        return means;
    }
}
