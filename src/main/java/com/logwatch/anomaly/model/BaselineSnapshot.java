package com.logwatch.anomaly.model;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable, versioned view of every baseline plus the known error signatures and
 * regions per service. Recomputation builds a new instance; readers hold whichever
 * instance they fetched and never see a half-built one.
 */
public final class BaselineSnapshot {

    private final long version;
    private final long computedAt;
    private final ZoneId zone;
    private final Map<BaselineKey, Baseline> baselines;
    private final Map<String, Set<String>> knownSignatures;
    private final Map<String, Set<String>> knownRegions;

    public BaselineSnapshot(long version, long computedAt, ZoneId zone,
                            Map<BaselineKey, Baseline> baselines,
                            Map<String, Set<String>> knownSignatures,
                            Map<String, Set<String>> knownRegions) {
        this.version = version;
        this.computedAt = computedAt;
        this.zone = zone;
        this.baselines = Map.copyOf(baselines);
        this.knownSignatures = copyOfSets(knownSignatures);
        this.knownRegions = copyOfSets(knownRegions);
    }

    public static BaselineSnapshot empty(ZoneId zone) {
        return new BaselineSnapshot(0, 0, zone, Map.of(), Map.of(), Map.of());
    }

    public Optional<Baseline> find(String service, Metric metric, long timestampMillis) {
        ZonedDateTime at = Instant.ofEpochMilli(timestampMillis).atZone(zone);
        return find(new BaselineKey(service, metric, at.getHour(), at.getDayOfWeek().getValue()));
    }

    public Optional<Baseline> find(BaselineKey key) {
        return Optional.ofNullable(baselines.get(key));
    }

    /** Empty when the service had no traffic during the baseline window. */
    public Optional<Set<String>> knownSignatures(String service) {
        return Optional.ofNullable(knownSignatures.get(service));
    }

    public Optional<Set<String>> knownRegions(String service) {
        return Optional.ofNullable(knownRegions.get(service));
    }

    /** Services holding at least one baseline for {@code metric}, at any hour. */
    public Set<String> servicesWith(Metric metric) {
        Set<String> services = new TreeSet<>();
        for (BaselineKey key : baselines.keySet()) {
            if (key.metric() == metric) services.add(key.service());
        }
        return services;
    }

    public Collection<Baseline> getBaselines() {
        return baselines.values();
    }

    public Map<BaselineKey, Baseline> asMap() {
        return baselines;
    }

    public Map<String, Set<String>> getKnownSignatures() {
        return knownSignatures;
    }

    public Map<String, Set<String>> getKnownRegions() {
        return knownRegions;
    }

    public long getVersion() { return version; }
    public long getComputedAt() { return computedAt; }
    public ZoneId getZone() { return zone; }

    private static Map<String, Set<String>> copyOfSets(Map<String, Set<String>> source) {
        Map<String, Set<String>> copy = new HashMap<>();
        source.forEach((k, v) -> copy.put(k, Set.copyOf(v)));
        return Map.copyOf(copy);
    }
}
