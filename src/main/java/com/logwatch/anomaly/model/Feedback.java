package com.logwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Append-only human judgment about an anomaly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Operator feedback about an anomaly")
public class Feedback {
    private String feedbackId;
    private String anomalyId;
    // Copied from the anomaly so per-rule ratios need no join
    private String ruleId;
    private FeedbackType type;
    private String actor;
    private long createdAt;
    private String note;
}
