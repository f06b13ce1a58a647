package com.logwatch.anomaly.engine.isolationforest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A trained per-service isolation forest together with the score cut-off taken
 * from its own training data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MultivariateModel {
    private String service;
    private IsolationForest forest;
    private double scoreThreshold;
    private double[] featureMeans;
    private int trainingSamples;
    private long trainedAt;
}
