package com.logwatch.anomaly.service;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.engine.ingest.FeatureAggregator;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.RawEvent;
import com.logwatch.anomaly.repository.MetricSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Replays the trailing history window through the same aggregation the ingester uses.
 * Reads one day at a time so a week of raw events never sits in memory at once.
 */
@Component
public class TrailingWindowReader {

    private static final Logger log = LoggerFactory.getLogger(TrailingWindowReader.class);
    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    private final MetricSource metricSource;
    private final FeatureAggregator aggregator;
    private final EngineConfig config;
    private final Clock clock;

    public TrailingWindowReader(MetricSource metricSource, FeatureAggregator aggregator,
                                EngineConfig config, Clock clock) {
        this.metricSource = metricSource;
        this.aggregator = aggregator;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Feature samples for every complete bucket in the trailing window ending at the
     * last bucket boundary. Only (service, bucket) pairs with traffic appear.
     *
     * @throws com.logwatch.anomaly.exception.SourceUnavailableException if any day cannot be read
     */
    public List<FeatureSample> readWindow() {
        long width = bucketWidthMillis();
        long end = windowEnd(width);
        return read(end - windowMillis(), end, width);
    }

    /**
     * Like {@link #readWindow()}, but every service seen anywhere in the window also gets a
     * quiet sample for each bucket in which it sent nothing. Volume statistics built from
     * this view count silent buckets as zero requests.
     */
    public List<FeatureSample> readWindowWithQuietBuckets() {
        long width = bucketWidthMillis();
        long end = windowEnd(width);
        long start = end - windowMillis();
        List<FeatureSample> samples = read(start, end, width);

        Map<String, Set<Long>> active = new TreeMap<>();
        for (FeatureSample sample : samples) {
            active.computeIfAbsent(sample.getService(), s -> new HashSet<>()).add(sample.getBucketStart());
        }

        int quiet = 0;
        for (Map.Entry<String, Set<Long>> entry : active.entrySet()) {
            for (long bucketStart = start; bucketStart < end; bucketStart += width) {
                if (!entry.getValue().contains(bucketStart)) {
                    samples.add(FeatureSample.quiet(entry.getKey(), bucketStart, bucketStart + width));
                    quiet++;
                }
            }
        }
        log.debug("Added {} quiet buckets for {} services", quiet, active.size());
        return samples;
    }

    private List<FeatureSample> read(long start, long end, long width) {
        List<FeatureSample> samples = new ArrayList<>();
        for (long dayStart = start; dayStart < end; dayStart += DAY_MILLIS) {
            long dayEnd = Math.min(dayStart + DAY_MILLIS, end);
            List<RawEvent> events = metricSource.fetch(dayStart, dayEnd);
            samples.addAll(aggregator.aggregateRange(events, dayStart, dayEnd, width));
        }

        log.debug("Read {} feature samples from trailing window [{}, {})", samples.size(), start, end);
        return samples;
    }

    private long windowEnd(long width) {
        return Math.floorDiv(clock.millis(), width) * width;
    }

    private long windowMillis() {
        return config.getBaseline().getWindowDays() * DAY_MILLIS;
    }

    public long bucketWidthMillis() {
        return config.getAnalysisIntervalSeconds() * 1000L;
    }
}
