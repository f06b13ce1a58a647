package com.logwatch.anomaly.service;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.config.MetricsConfig;
import com.logwatch.anomaly.engine.ingest.FeatureAggregator;
import com.logwatch.anomaly.exception.SourceUnavailableException;
import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.IngestionStatus;
import com.logwatch.anomaly.model.RawEvent;
import com.logwatch.anomaly.model.RuleType;
import com.logwatch.anomaly.repository.EngineStateRepository;
import com.logwatch.anomaly.repository.MetricSource;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pulls raw events from the metric source bucket by bucket and feeds them to detection.
 *
 * The watermark is the end of the last fully processed bucket. It is persisted after each
 * bucket, so a restart resumes at the first unprocessed bucket and an outage leaves it where
 * it was for the next tick to backfill.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    static final String ENGINE_SERVICE = "anomaly-engine";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_IDLE = "idle";
    public static final String OUTCOME_SOURCE_UNAVAILABLE = "source_unavailable";
    public static final String OUTCOME_ERROR = "error";
    public static final String OUTCOME_BUSY = "busy";

    private final MetricSource metricSource;
    private final FeatureAggregator aggregator;
    private final DetectionService detectionService;
    private final AlertManagerService alertManagerService;
    private final EngineStateRepository stateRepository;
    private final EngineConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final ReentrantLock tickLock = new ReentrantLock();

    private volatile long watermark;
    private volatile long lastTickAt;
    private volatile String lastOutcome = OUTCOME_IDLE;
    private volatile int consecutiveFailures;

    public IngestionService(MetricSource metricSource,
                            FeatureAggregator aggregator,
                            DetectionService detectionService,
                            AlertManagerService alertManagerService,
                            EngineStateRepository stateRepository,
                            EngineConfig config,
                            MetricsConfig metricsConfig,
                            Clock clock) {
        this.metricSource = metricSource;
        this.aggregator = aggregator;
        this.detectionService = detectionService;
        this.alertManagerService = alertManagerService;
        this.stateRepository = stateRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${engine.analysis-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS)
    public void scheduledTick() {
        tick();
    }

    /**
     * Process every complete bucket between the watermark and now.
     *
     * @return the tick outcome, one of the {@code OUTCOME_*} constants
     */
    @Observed(name = "ingest.tick", contextualName = "ingest-tick")
    public String tick() {
        if (!tickLock.tryLock()) {
            log.debug("Previous ingest tick still running, skipping");
            metricsConfig.recordIngestTick(OUTCOME_BUSY, 0);
            return OUTCOME_BUSY;
        }
        int processed = 0;
        String outcome;
        try {
            long width = bucketWidthMillis();
            long now = clock.millis();
            long lastBoundary = Math.floorDiv(now, width) * width;
            long current = startingWatermark(lastBoundary, width);

            while (current + width <= lastBoundary) {
                long bucketEnd = current + width;
                processBucket(current, bucketEnd);
                stateRepository.saveWatermark(bucketEnd, clock.millis());
                watermark = bucketEnd;
                current = bucketEnd;
                processed++;
            }

            outcome = processed > 0 ? OUTCOME_SUCCESS : OUTCOME_IDLE;
            if (consecutiveFailures > 0) {
                log.info("Metric source recovered after {} failed ticks", consecutiveFailures);
            }
            consecutiveFailures = 0;
            metricsConfig.updateConsecutiveIngestFailures(0);
        } catch (SourceUnavailableException e) {
            outcome = OUTCOME_SOURCE_UNAVAILABLE;
            onSourceFailure(e);
        } catch (Exception e) {
            outcome = OUTCOME_ERROR;
            log.error("Ingest tick failed at watermark {}", watermark, e);
        } finally {
            tickLock.unlock();
        }

        lastTickAt = clock.millis();
        lastOutcome = outcome;
        metricsConfig.recordIngestTick(outcome, processed);
        if (processed > 1) {
            log.info("Ingest tick processed {} buckets, watermark now {}", processed, Instant.ofEpochMilli(watermark));
        }
        return outcome;
    }

    public IngestionStatus getStatus() {
        return IngestionStatus.builder()
                .watermark(watermark)
                .lastTickAt(lastTickAt)
                .lastOutcome(lastOutcome)
                .consecutiveFailures(consecutiveFailures)
                .bucketWidthSeconds(config.getAnalysisIntervalSeconds())
                .build();
    }

    private long startingWatermark(long lastBoundary, long width) {
        long start;
        if (watermark > 0) {
            start = watermark;
        } else {
            OptionalLong persisted = stateRepository.findWatermark();
            if (persisted.isPresent()) {
                start = persisted.getAsLong();
                log.info("Resuming ingestion from persisted watermark {}", Instant.ofEpochMilli(start));
            } else {
                start = lastBoundary - width;
                log.info("No persisted watermark, starting at {}", Instant.ofEpochMilli(start));
            }
        }

        long maxBacklogMillis = config.getMaxBacklogMinutes() * 60_000L;
        long floor = Math.floorDiv(lastBoundary - maxBacklogMillis, width) * width;
        if (start < floor) {
            log.warn("Ingest backlog exceeds {} minutes, skipping range [{}, {})",
                    config.getMaxBacklogMinutes(), Instant.ofEpochMilli(start), Instant.ofEpochMilli(floor));
            start = floor;
        }
        watermark = start;
        return start;
    }

    private void processBucket(long bucketStart, long bucketEnd) {
        List<RawEvent> events = metricSource.fetch(bucketStart, bucketEnd);
        List<FeatureSample> samples = aggregator.aggregate(events, bucketStart, bucketEnd);
        log.debug("Bucket [{}, {}): {} events, {} services", bucketStart, bucketEnd, events.size(), samples.size());
        detectionService.detect(bucketStart, bucketEnd, samples);
    }

    private void onSourceFailure(SourceUnavailableException e) {
        consecutiveFailures++;
        metricsConfig.updateConsecutiveIngestFailures(consecutiveFailures);
        log.warn("Metric source unavailable, watermark held at {} (consecutive failures: {}): {}",
                watermark, consecutiveFailures, e.getMessage());

        if (consecutiveFailures == config.getConsecutiveFailureAlertThreshold()) {
            raiseSourceUnavailable(e);
        }
    }

    private void raiseSourceUnavailable(SourceUnavailableException cause) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("consecutiveFailures", consecutiveFailures);
        metadata.put("watermark", watermark);
        metadata.put("lastError", String.valueOf(cause.getMessage()));
        metadata.put(Anomaly.META_OCCURRENCES, 1);

        Anomaly candidate = Anomaly.builder()
                .detectedAt(clock.millis())
                .ruleId(RuleType.ENGINE_SOURCE_UNAVAILABLE.name())
                .service(ENGINE_SERVICE)
                .severity(RuleType.ENGINE_SOURCE_UNAVAILABLE.getSeverity())
                .score(1.0)
                .metadata(metadata)
                .build();
        try {
            alertManagerService.submit(candidate);
            log.error("Metric source failed {} consecutive ticks, raised {}",
                    consecutiveFailures, RuleType.ENGINE_SOURCE_UNAVAILABLE);
        } catch (Exception e) {
            log.error("Could not raise source-unavailable anomaly", e);
        }
    }

    private long bucketWidthMillis() {
        return config.getAnalysisIntervalSeconds() * 1000L;
    }
}
