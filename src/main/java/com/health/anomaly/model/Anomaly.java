package com.health.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "A single metric value that fell outside the user's expected range on a given day")
public class Anomaly {

    @Schema(description = "Anomaly identifier, stable for (userId, date, metricType)",
            example = "3f8a2c4e-5b1d-3c9e-8f7a-2d6e4b1c9a0f")
    String id;

    @Schema(description = "User identifier", example = "USER-001")
    String userId;

    @Schema(description = "Date of the sample that produced the anomaly", example = "2026-10-17")
    LocalDate date;

    @Schema(description = "Metric that deviated", example = "STEPS")
    MetricType metricType;

    @Schema(description = "Category derived from metric and deviation direction", example = "LOW_ACTIVITY")
    AnomalyCategory category;

    @Schema(description = "Detection timestamp")
    Instant detectedAt;

    @Schema(description = "Observed value", example = "2000.0")
    double actualValue;

    @Schema(description = "Lower bound of the expected range", example = "4000.0")
    double expectedMin;

    @Schema(description = "Upper bound of the expected range", example = "8000.0")
    double expectedMax;

    @Schema(description = "Severity tier", example = "ALERT")
    Severity severity;

    @Schema(description = "Human-readable description",
            example = "Your step count (2000 steps) is significantly below your usual range (4000 steps - 8000 steps).")
    String message;

    @Schema(description = "Whether the user has acknowledged this anomaly", example = "false")
    boolean acknowledged;

    /**
     * Name-based id for the {@code (userId, date, metricType)} triple, so that a
     * re-run over the same day maps onto the same record.
     */
    public static String idFor(String userId, LocalDate date, MetricType metricType) {
        String name = userId + "|" + date + "|" + metricType.name();
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
