package com.logwatch.anomaly.service;

import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.config.MetricsConfig;
import com.logwatch.anomaly.exception.SourceUnavailableException;
import com.logwatch.anomaly.model.Baseline;
import com.logwatch.anomaly.model.BaselineSnapshot;
import com.logwatch.anomaly.model.FeatureSample;
import com.logwatch.anomaly.model.Metric;
import com.logwatch.anomaly.repository.BaselineRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.logwatch.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BaselineServiceTest {

    private static final long WEEK = Duration.ofDays(7).toMillis();

    @Mock private TrailingWindowReader windowReader;
    @Mock private BaselineRepository baselineRepository;
    @Mock private MetricsConfig metricsConfig;

    private BaselineService service;

    @BeforeEach
    void setUp() {
        service = new BaselineService(windowReader, baselineRepository, new EngineConfig(), metricsConfig,
                Clock.fixed(Instant.ofEpochMilli(T0 + 21 * WEEK), ZoneOffset.UTC));
    }

    @Test
    void recompute_sameHourOfWeek_meanAndSampleStdDev() {
        when(windowReader.readWindowWithQuietBuckets()).thenReturn(List.of(
                sample("search", T0).requestCount(90).build(),
                sample("search", T0 + WEEK).requestCount(100).build(),
                sample("search", T0 + 2 * WEEK).requestCount(110).build()));

        BaselineSnapshot snapshot = service.recompute().orElseThrow();

        Baseline volume = snapshot.find("search", Metric.REQUEST_COUNT, T0).orElseThrow();
        assertThat(volume.getMean()).isCloseTo(100.0, within(1e-9));
        assertThat(volume.getStdDev()).isCloseTo(10.0, within(1e-9));
        assertThat(volume.getSampleCount()).isEqualTo(3);
        assertThat(volume.getHourOfDay()).isEqualTo(T0_HOUR);
        assertThat(volume.getDayOfWeek()).isEqualTo(T0_DAY_OF_WEEK);
        assertThat(snapshot.getVersion()).isEqualTo(1);
        assertThat(service.current()).isSameAs(snapshot);
        verify(baselineRepository).save(snapshot);
        verify(metricsConfig).updateBaselineSnapshotVersion(1);
    }

    @Test
    void recompute_quietBucketsPullVolumeDownOnly() {
        when(windowReader.readWindowWithQuietBuckets()).thenReturn(List.of(
                sample("search", T0).requestCount(100).p95LatencyMs(200).build(),
                sample("search", T0 + WEEK).requestCount(100).p95LatencyMs(200).build(),
                FeatureSample.quiet("search", T0 + 2 * WEEK, T0 + 2 * WEEK + MINUTE)));

        BaselineSnapshot snapshot = service.recompute().orElseThrow();

        Baseline volume = snapshot.find("search", Metric.REQUEST_COUNT, T0).orElseThrow();
        assertThat(volume.getMean()).isCloseTo(200.0 / 3, within(1e-9));
        assertThat(volume.getSampleCount()).isEqualTo(3);
        Baseline latency = snapshot.find("search", Metric.P95_LATENCY, T0).orElseThrow();
        assertThat(latency.getMean()).isCloseTo(200.0, within(1e-9));
        assertThat(latency.getSampleCount()).isEqualTo(2);
    }

    @Test
    void recompute_collectsKnownSignaturesAndRegions() {
        when(windowReader.readWindowWithQuietBuckets()).thenReturn(List.of(
                sample("orders", T0).requestCount(10).errorCount(1).errorSignature("sig-a").region("eu-west").build(),
                sample("orders", T0 + MINUTE).requestCount(10).errorSignature("sig-b").build()));

        BaselineSnapshot snapshot = service.recompute().orElseThrow();

        assertThat(snapshot.knownSignatures("orders")).contains(Set.of("sig-a", "sig-b"));
        assertThat(snapshot.knownRegions("orders")).contains(Set.of("eu-west"));
        assertThat(snapshot.knownSignatures("unseen")).isEmpty();
    }

    @Test
    void recompute_keysMissingFromWindowCarriedOver() {
        Baseline old = baseline("legacy", Metric.REQUEST_COUNT, 5, 1, 40);
        when(baselineRepository.load(ZoneOffset.UTC)).thenReturn(Optional.of(
                new BaselineSnapshot(4, T0, ZoneOffset.UTC, Map.of(old.key(), old), Map.of(), Map.of())));
        service.loadPersisted();
        when(windowReader.readWindowWithQuietBuckets()).thenReturn(List.of(sample("search", T0).requestCount(100).build()));

        BaselineSnapshot snapshot = service.recompute().orElseThrow();

        assertThat(snapshot.getVersion()).isEqualTo(5);
        assertThat(snapshot.find(old.key())).contains(old);
        assertThat(snapshot.find("search", Metric.REQUEST_COUNT, T0)).isPresent();
    }

    @Test
    void recompute_sourceDown_previousSnapshotKept() {
        when(windowReader.readWindowWithQuietBuckets()).thenThrow(new SourceUnavailableException("timeout", null));
        BaselineSnapshot before = service.current();

        assertThatThrownBy(() -> service.recompute()).isInstanceOf(SourceUnavailableException.class);
        service.scheduledRecompute();

        assertThat(service.current()).isSameAs(before);
        verify(baselineRepository, never()).save(any());
    }

    @Test
    void loadPersisted_storeDown_startsEmpty() {
        when(baselineRepository.load(ZoneOffset.UTC)).thenThrow(new IllegalStateException("cluster down"));

        service.loadPersisted();

        assertThat(service.current().getVersion()).isZero();
        assertThat(service.current().getBaselines()).isEmpty();
    }

    @Test
    void runningStats_singleValue_zeroStdDev() {
        BaselineService.RunningStats stats = new BaselineService.RunningStats();
        stats.add(42);

        assertThat(stats.mean()).isEqualTo(42.0);
        assertThat(stats.sampleStdDev()).isZero();
    }
}
