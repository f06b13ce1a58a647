package com.logwatch.anomaly.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * What a rule reports when it fires: the unweighted score and the values it compared.
 */
@Value
@Builder
public class RuleHit {

    // Normalized distance past the threshold, before the feedback weight is applied
    double rawScore;

    @Singular("detail")
    Map<String, Object> details;
}
