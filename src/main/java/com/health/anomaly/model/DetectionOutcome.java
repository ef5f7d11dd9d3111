package com.health.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
@Schema(description = "Result of one detection run for one daily sample")
public class DetectionOutcome {

    public static final String NO_BASELINE = "no_baseline";
    public static final String ML_UNAVAILABLE = "ml_unavailable";
    public static final String ML_LOW_CONFIDENCE = "ml_low_confidence";
    public static final String ML_ERROR_PREFIX = "ml_error: ";

    @Schema(description = "Detected anomalies in metric order")
    List<Anomaly> anomalies;

    @Schema(description = "True when the rule-based threshold path was used (or nothing could run)")
    boolean usedFallback;

    @Schema(description = "Why the ML result was not used", example = "ml_unavailable", nullable = true)
    String fallbackReason;

    public static DetectionOutcome fromModel(List<Anomaly> anomalies) {
        return new DetectionOutcome(List.copyOf(anomalies), false, null);
    }

    public static DetectionOutcome fallback(List<Anomaly> anomalies, String reason) {
        return new DetectionOutcome(List.copyOf(anomalies), true, reason);
    }

    public static DetectionOutcome noBaseline() {
        return new DetectionOutcome(List.of(), true, NO_BASELINE);
    }

    public Optional<String> fallbackReasonIfAny() {
        return Optional.ofNullable(fallbackReason);
    }
}
