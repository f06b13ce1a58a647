package com.logwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Detection rule with its trailing false-positive ratio")
public class RuleStats {
    private String ruleId;
    private String name;
    private Severity severity;
    private boolean enabled;
    private int falsePositiveCount;
    private int totalRaised;
    private double falsePositiveRatio;
    @Schema(description = "Multiplier applied to the rule's anomaly scores", example = "0.8")
    private double weight;
    @Schema(description = "Ratio exceeded the review threshold. Advisory only, the rule keeps running")
    private boolean flaggedForReview;
    private long computedAt;
}
