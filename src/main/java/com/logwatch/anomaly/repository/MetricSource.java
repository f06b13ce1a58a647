package com.logwatch.anomaly.repository;

import com.logwatch.anomaly.exception.SourceUnavailableException;
import com.logwatch.anomaly.model.RawEvent;

import java.util.List;

/**
 * Read-only access to the per-request samples produced by the log pipeline.
 * Both the ingester and the baseline recomputation read through this seam.
 */
public interface MetricSource {

    /**
     * Fetch every raw event with {@code fromInclusive <= timestamp < toExclusive}.
     *
     * @throws SourceUnavailableException when the source is unreachable or the query times out
     */
    List<RawEvent> fetch(long fromInclusive, long toExclusive);
}
