package com.logwatch.anomaly.engine.ingest;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.RawEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Rolls raw request events up into one {@link FeatureSample} per (service, bucket).
 * Shared by the ingester and the baseline recomputation so both see identical features.
 */
@Component
public class FeatureAggregator {

    private static final double LATENCY_PERCENTILE = 0.95;

    private final SourceHasher sourceHasher;
    private final long authWindowMillis;

    public FeatureAggregator(SourceHasher sourceHasher, EngineConfig config) {
        this.sourceHasher = sourceHasher;
        this.authWindowMillis = config.getDetection().getAuthFailureWindowSeconds() * 1000L;
    }

    /**
     * Aggregate events of a single bucket. Events outside {@code [bucketStart, bucketEnd)} are ignored.
     * Services with no events in the bucket produce no sample.
     */
    public List<FeatureSample> aggregate(List<RawEvent> events, long bucketStart, long bucketEnd) {
        Map<String, List<RawEvent>> byService = new TreeMap<>();
        for (RawEvent event : events) {
            if (event.getService() == null) continue;
            if (event.getTimestamp() < bucketStart || event.getTimestamp() >= bucketEnd) continue;
            byService.computeIfAbsent(event.getService(), s -> new ArrayList<>()).add(event);
        }

        List<FeatureSample> samples = new ArrayList<>(byService.size());
        for (Map.Entry<String, List<RawEvent>> entry : byService.entrySet()) {
            samples.add(aggregateService(entry.getKey(), entry.getValue(), bucketStart, bucketEnd));
        }
        return samples;
    }

    /**
     * Split a longer range into aligned buckets of {@code bucketWidthMillis} and aggregate each.
     */
    public List<FeatureSample> aggregateRange(List<RawEvent> events, long from, long to, long bucketWidthMillis) {
        Map<Long, List<RawEvent>> byBucket = new TreeMap<>();
        for (RawEvent event : events) {
            if (event.getTimestamp() < from || event.getTimestamp() >= to) continue;
            long bucketStart = Math.floorDiv(event.getTimestamp(), bucketWidthMillis) * bucketWidthMillis;
            byBucket.computeIfAbsent(bucketStart, b -> new ArrayList<>()).add(event);
        }

        List<FeatureSample> samples = new ArrayList<>();
        for (Map.Entry<Long, List<RawEvent>> entry : byBucket.entrySet()) {
            long start = entry.getKey();
            samples.addAll(aggregate(entry.getValue(), start, start + bucketWidthMillis));
        }
        return samples;
    }

    private FeatureSample aggregateService(String service, List<RawEvent> events, long bucketStart, long bucketEnd) {
        long errorCount = 0;
        List<Double> latencies = new ArrayList<>(events.size());
        Set<String> rawSources = new HashSet<>();
        Set<String> hashedSources = new HashSet<>();
        Map<String, List<Long>> authFailuresBySource = new HashMap<>();

        FeatureSample.FeatureSampleBuilder builder = FeatureSample.builder()
                .service(service)
                .bucketStart(bucketStart)
                .bucketEnd(bucketEnd)
                .requestCount(events.size());

        for (RawEvent event : events) {
            latencies.add(event.getLatencyMs());

            String hashed = sourceHasher.hash(event.getSourceId());
            if (event.getSourceId() != null) {
                rawSources.add(event.getSourceId());
                hashedSources.add(hashed);
            }

            if (event.isError()) {
                errorCount++;
            }
            if (event.getErrorSignature() != null && !event.getErrorSignature().isEmpty()) {
                builder.errorSignature(event.getErrorSignature());
            }
            if (event.getRegion() != null && !event.getRegion().isEmpty()) {
                builder.region(event.getRegion());
            }
            if (event.isAuthFailure() && hashed != null) {
                authFailuresBySource.computeIfAbsent(hashed, h -> new ArrayList<>()).add(event.getTimestamp());
            }
        }

        for (Map.Entry<String, List<Long>> entry : authFailuresBySource.entrySet()) {
            builder.authFailurePeak(entry.getKey(), peakInWindow(entry.getValue(), authWindowMillis));
        }

        return builder
                .errorCount(errorCount)
                .p95LatencyMs(nearestRankPercentile(latencies, LATENCY_PERCENTILE))
                .distinctSourceCount(rawSources.size())
                .hashedSourceCount(hashedSources.size())
                .build();
    }

    /**
     * Largest number of timestamps that fit in any window {@code [t, t + windowMillis)}.
     */
    static int peakInWindow(List<Long> timestamps, long windowMillis) {
        List<Long> sorted = new ArrayList<>(timestamps);
        sorted.sort(null);
        int peak = 0;
        int lo = 0;
        for (int hi = 0; hi < sorted.size(); hi++) {
            while (sorted.get(hi) - sorted.get(lo) >= windowMillis) {
                lo++;
            }
            peak = Math.max(peak, hi - lo + 1);
        }
        return peak;
    }

    static double nearestRankPercentile(List<Double> values, double percentile) {
        if (values.isEmpty()) return 0.0;
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(null);
        int rank = (int) Math.ceil(percentile * sorted.size());
        return sorted.get(Math.max(rank, 1) - 1);
    }
}
