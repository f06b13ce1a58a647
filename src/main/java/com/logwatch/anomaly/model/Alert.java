package com.logwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A notification decision for one anomaly on one channel")
public class Alert {

    @Schema(description = "Unique alert identifier")
    private String alertId;

    @Schema(description = "Anomaly the alert notifies about")
    private String anomalyId;

    @Schema(description = "Delivery channel", example = "webhook")
    private String channel;

    private Severity severity;

    @Schema(description = "True when queued for the combined batch message rather than sent on creation")
    private boolean batched;

    private AlertStatus status;

    private long createdAt;

    @Schema(description = "Delivery time, epoch millis (0 until sent)")
    private long sentAt;

    private int attempts;
    private String lastError;

    private long acknowledgedAt;
    private String acknowledgedBy;
}
