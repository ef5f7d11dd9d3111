package com.health.anomaly.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Structured answer from an optional ML model: either candidate anomalies with
 * a confidence score, or a failure with a reason.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MlSignalResult {

    boolean success;
    List<Anomaly> candidates;
    double confidence;
    String failureReason;

    public static MlSignalResult success(List<Anomaly> candidates, double confidence) {
        return new MlSignalResult(true, List.copyOf(candidates), confidence, null);
    }

    public static MlSignalResult failure(String reason) {
        return new MlSignalResult(false, List.of(), 0.0, reason);
    }
}
