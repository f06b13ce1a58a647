package com.logwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

@Value
@Builder
@Schema(description = "Aggregated observation for one service over one bucket")
public class FeatureSample {

    @Schema(description = "Service name", example = "billing-api")
    String service;

    @Schema(description = "Bucket start, epoch millis", example = "1739886720000")
    long bucketStart;

    @Schema(description = "Bucket end (exclusive), epoch millis", example = "1739886780000")
    long bucketEnd;

    long requestCount;

    long errorCount;

    double p95LatencyMs;

    @Schema(description = "Distinct raw source identifiers seen in the bucket")
    long distinctSourceCount;

    @Schema(description = "Size of the hashed source set")
    long hashedSourceCount;

    @Schema(description = "Per hashed source: peak authentication failures inside the sliding window")
    @Singular("authFailurePeak")
    Map<String, Integer> authFailurePeaks;

    @Singular
    Set<String> errorSignatures;

    @Singular
    Set<String> regions;

    /**
     * A bucket in which the service sent no requests at all. Every count is zero and every set empty.
     */
    public static FeatureSample quiet(String service, long bucketStart, long bucketEnd) {
        return FeatureSample.builder()
                .service(service)
                .bucketStart(bucketStart)
                .bucketEnd(bucketEnd)
                .build();
    }

    public boolean isQuiet() {
        return requestCount == 0;
    }

    public double getErrorRate() {
        if (requestCount == 0) return 0.0;
        return (double) errorCount / requestCount;
    }

    public int getPeakAuthFailures() {
        int peak = 0;
        for (int count : authFailurePeaks.values()) {
            peak = Math.max(peak, count);
        }
        return peak;
    }

    public double getMetricValue(Metric metric) {
        return switch (metric) {
            case ERROR_RATE -> getErrorRate();
            case REQUEST_COUNT -> requestCount;
            case P95_LATENCY -> p95LatencyMs;
            case DISTINCT_SOURCES -> distinctSourceCount;
        };
    }
}
