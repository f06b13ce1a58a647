package com.logwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Expected distribution of one metric for one service at one hour of one weekday")
public class Baseline {

    @Schema(description = "Service name", example = "billing-api")
    String service;

    @Schema(description = "Metric", example = "REQUEST_COUNT")
    Metric metric;

    @Schema(description = "Hour of day 0-23 in the baseline zone", example = "14")
    int hourOfDay;

    @Schema(description = "ISO day of week 1 (Monday) - 7 (Sunday)", example = "2")
    int dayOfWeek;

    @Schema(description = "Mean of the bucket values", example = "100.0")
    double mean;

    @Schema(description = "Sample standard deviation", example = "10.0")
    double stdDev;

    @Schema(description = "Number of buckets that contributed", example = "60")
    long sampleCount;

    @Schema(description = "When the snapshot holding this baseline was computed, epoch millis")
    long computedAt;

    public BaselineKey key() {
        return new BaselineKey(service, metric, hourOfDay, dayOfWeek);
    }

    public boolean isConfident(long minSamples) {
        return sampleCount >= minSamples;
    }
}
