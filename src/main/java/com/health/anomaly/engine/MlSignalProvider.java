package com.health.anomaly.engine;

import com.health.anomaly.model.MetricSample;
import com.health.anomaly.model.MlSignalResult;
import com.health.anomaly.model.UserBaseline;

/**
 * Optional model-based anomaly source. Implementations may block, fail or
 * throw; {@link AnomalyDetectionCoordinator} bounds the call with a timeout and
 * falls back to threshold detection on any of these.
 */
public interface MlSignalProvider {

    MlSignalResult analyze(MetricSample sample, UserBaseline baseline);
}
