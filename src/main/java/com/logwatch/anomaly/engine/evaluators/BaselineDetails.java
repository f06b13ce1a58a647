package com.logwatch.anomaly.engine.evaluators;

import com.logwatch.anomaly.engine.RuleHit;
import com.logwatch.anomaly.model.Baseline;

final class BaselineDetails {

    private BaselineDetails() {}

    static RuleHit.RuleHitBuilder hit(double rawScore, Baseline baseline, double observed, double threshold) {
        return RuleHit.builder()
                .rawScore(rawScore)
                .detail("observed", observed)
                .detail("baselineMean", baseline.getMean())
                .detail("baselineStdDev", baseline.getStdDev())
                .detail("baselineSamples", baseline.getSampleCount())
                .detail("threshold", threshold);
    }

    /**
     * Excess over the threshold as a fraction of the allowed range. A zero range
     * (constant history) scores 1.0 for any excess.
     */
    static double normalizedExcess(double excess, double allowedRange) {
        return allowedRange > 0 ? excess / allowedRange : 1.0;
    }
}
