package com.health.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Per-user "normal" reference: mean and population standard deviation of each
 * metric over a historical window. Replaced wholesale on every recomputation.
 * A metric that was never recorded in the window is absent from both maps.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Per-metric mean and standard deviation computed from a user's recent history")
public class UserBaseline {

    public static final int MIN_BASELINE_DAYS = 7;

    @Schema(description = "User identifier", example = "USER-001")
    String userId;

    @Singular("mean")
    @Schema(description = "Mean per metric", example = "{\"STEPS\": 6000.0, \"SLEEP\": 420.0}")
    Map<MetricType, Double> perMetricMean;

    @Singular("stdDev")
    @Schema(description = "Population standard deviation per metric", example = "{\"STEPS\": 1000.0, \"SLEEP\": 30.0}")
    Map<MetricType, Double> perMetricStdDev;

    @Schema(description = "Number of daily samples the baseline was computed from", example = "30")
    int sampleCount;

    @Schema(description = "When the baseline was computed")
    Instant calculatedAt;

    @Schema(description = "True when enough days were available for the baseline to drive detection")
    public boolean isValid() {
        return sampleCount >= MIN_BASELINE_DAYS;
    }

    public boolean covers(MetricType metricType) {
        return perMetricMean.containsKey(metricType) && perMetricStdDev.containsKey(metricType);
    }

    public double meanOf(MetricType metricType) {
        return perMetricMean.get(metricType);
    }

    public double stdDevOf(MetricType metricType) {
        return perMetricStdDev.get(metricType);
    }
}
