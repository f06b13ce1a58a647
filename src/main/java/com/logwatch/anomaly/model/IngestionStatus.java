package com.logwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionStatus {
    private long watermark;
    private long lastTickAt;
    private String lastOutcome;
    private int consecutiveFailures;
    private int bucketWidthSeconds;
}
