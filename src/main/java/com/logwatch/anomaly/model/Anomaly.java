package com.logwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single detection event and its lifecycle")
public class Anomaly {

    public static final String META_OCCURRENCES = "occurrences";
    public static final String META_LAST_SEEN_AT = "lastSeenAt";
    public static final String META_PEAK_SCORE = "peakScore";

    @Schema(description = "Unique anomaly identifier", example = "2f1c7a9e-0c55-4d8b-9d0f-6a1f3e2b7c10")
    private String anomalyId;

    @Schema(description = "Detection timestamp (end of the triggering bucket), epoch millis", example = "1739886780000")
    private long detectedAt;

    @Schema(description = "Triggering rule", example = "VOLUME_ANOMALY")
    private String ruleId;

    @Schema(description = "Service the sample belongs to", example = "billing-api")
    private String service;

    @Schema(description = "Severity from the fixed rule mapping", example = "WARNING")
    private Severity severity;

    @Schema(description = "Normalized distance past the threshold, scaled by the rule's feedback weight", example = "0.17")
    private double score;

    @Schema(description = "Feature values and baseline values the rule compared")
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Schema(description = "Lifecycle status", example = "NEW")
    @Builder.Default
    private AnomalyStatus status = AnomalyStatus.NEW;

    private long acknowledgedAt;
    private String acknowledgedBy;

    @Schema(description = "When the anomaly reached a terminal state, epoch millis (0 while open)")
    private long resolvedAt;

    @Schema(description = "Who resolved or dismissed the anomaly")
    private String resolvedBy;

    private boolean falsePositive;

    // Aerospike record generation at read time; used for compare-and-set updates
    @JsonIgnore
    private int generation;

    public int getOccurrences() {
        Object value = metadata.get(META_OCCURRENCES);
        if (value instanceof Number n) return n.intValue();
        return 1;
    }
}
