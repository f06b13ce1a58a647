package com.logwatch.anomaly.service;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.config.MetricsConfig;
import com.logwatch.anomaly.exception.SourceUnavailableException;
import com.logwatch.anomaly.model.Baseline;
import com.logwatch.anomaly.model.BaselineKey;
import com.logwatch.anomaly.model.BaselineSnapshot;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.Metric;
import com.logwatch.anomaly.repository.BaselineRepository;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the baseline snapshot. Recomputation builds a complete new snapshot off to the
 * side and publishes it with a single reference swap; the detector only ever reads
 * {@link #current()}.
 */
@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    private final TrailingWindowReader windowReader;
    private final BaselineRepository baselineRepository;
    private final EngineConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final ZoneId zone;

    private final AtomicReference<BaselineSnapshot> current;
    private final ReentrantLock recomputeLock = new ReentrantLock();

    public BaselineService(TrailingWindowReader windowReader,
                           BaselineRepository baselineRepository,
                           EngineConfig config,
                           MetricsConfig metricsConfig,
                           Clock clock) {
        this.windowReader = windowReader;
        this.baselineRepository = baselineRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.zone = ZoneId.of(config.getBaseline().getZoneId());
        this.current = new AtomicReference<>(BaselineSnapshot.empty(zone));
    }

    @PostConstruct
    public void loadPersisted() {
        try {
            Optional<BaselineSnapshot> persisted = baselineRepository.load(zone);
            if (persisted.isPresent()) {
                publish(persisted.get());
                log.info("Loaded baseline snapshot v{} ({} keys)",
                        persisted.get().getVersion(), persisted.get().getBaselines().size());
            } else {
                log.info("No persisted baseline snapshot; starting empty until the first recomputation");
            }
        } catch (Exception e) {
            log.warn("Could not load persisted baseline snapshot, starting empty: {}", e.getMessage());
        }
    }

    public BaselineSnapshot current() {
        return current.get();
    }

    @Scheduled(fixedDelayString = "${engine.baseline.recompute-interval-minutes:60}",
               timeUnit = TimeUnit.MINUTES)
    public void scheduledRecompute() {
        try {
            recompute();
        } catch (SourceUnavailableException e) {
            log.warn("Baseline recomputation skipped, keeping snapshot v{}: {}",
                    current().getVersion(), e.getMessage());
        } catch (Exception e) {
            log.error("Baseline recomputation failed, keeping snapshot v{}", current().getVersion(), e);
        }
    }

    /**
     * Recompute every key touched by the trailing window and publish the result.
     * Buckets in which a known service was silent count as zero requests.
     * Keys absent from the window carry over from the previous snapshot.
     *
     * @return the published snapshot, or empty when another recomputation is already running
     * @throws SourceUnavailableException if the window cannot be read; the previous snapshot stays
     */
    @Observed(name = "baseline.recompute", contextualName = "recompute-baselines")
    public Optional<BaselineSnapshot> recompute() {
        if (!recomputeLock.tryLock()) {
            log.info("Baseline recomputation already in progress; skipping");
            return Optional.empty();
        }
        try {
            long startedAt = clock.millis();
            List<FeatureSample> samples = windowReader.readWindowWithQuietBuckets();

            Map<BaselineKey, RunningStats> stats = new HashMap<>();
            Map<String, Set<String>> signatures = new HashMap<>();
            Map<String, Set<String>> regions = new HashMap<>();

            for (FeatureSample sample : samples) {
                ZonedDateTime at = Instant.ofEpochMilli(sample.getBucketStart()).atZone(zone);
                int hour = at.getHour();
                int dayOfWeek = at.getDayOfWeek().getValue();
                for (Metric metric : Metric.values()) {
                    // a silent bucket says nothing about latency or error shape
                    if (sample.isQuiet() && metric != Metric.REQUEST_COUNT) continue;
                    stats.computeIfAbsent(new BaselineKey(sample.getService(), metric, hour, dayOfWeek),
                            k -> new RunningStats()).add(sample.getMetricValue(metric));
                }
                signatures.computeIfAbsent(sample.getService(), s -> new HashSet<>())
                        .addAll(sample.getErrorSignatures());
                regions.computeIfAbsent(sample.getService(), s -> new HashSet<>())
                        .addAll(sample.getRegions());
            }

            BaselineSnapshot previous = current.get();
            long computedAt = clock.millis();

            Map<BaselineKey, Baseline> baselines = new HashMap<>(previous.asMap());
            stats.forEach((key, running) -> baselines.put(key, Baseline.builder()
                    .service(key.service())
                    .metric(key.metric())
                    .hourOfDay(key.hourOfDay())
                    .dayOfWeek(key.dayOfWeek())
                    .mean(running.mean())
                    .stdDev(running.sampleStdDev())
                    .sampleCount(running.count())
                    .computedAt(computedAt)
                    .build()));

            Map<String, Set<String>> knownSignatures = new HashMap<>(previous.getKnownSignatures());
            knownSignatures.putAll(signatures);
            Map<String, Set<String>> knownRegions = new HashMap<>(previous.getKnownRegions());
            knownRegions.putAll(regions);

            BaselineSnapshot next = new BaselineSnapshot(previous.getVersion() + 1, computedAt, zone,
                    baselines, knownSignatures, knownRegions);

            baselineRepository.save(next);
            publish(next);

            log.info("Published baseline snapshot v{}: {} keys recomputed from {} samples, {} total, took {}ms",
                    next.getVersion(), stats.size(), samples.size(), baselines.size(),
                    clock.millis() - startedAt);
            return Optional.of(next);
        } finally {
            recomputeLock.unlock();
        }
    }

    private void publish(BaselineSnapshot snapshot) {
        current.set(snapshot);
        metricsConfig.updateBaselineSnapshotVersion(snapshot.getVersion());
    }

    /** Welford accumulator; sample (n - 1) standard deviation. */
    static final class RunningStats {
        private long count;
        private double mean;
        private double m2;

        void add(double value) {
            count++;
            double delta = value - mean;
            mean += delta / count;
            m2 += delta * (value - mean);
        }

        long count() { return count; }
        double mean() { return mean; }

        double sampleStdDev() {
            return count > 1 ? Math.sqrt(m2 / (count - 1)) : 0.0;
        }
    }
}
