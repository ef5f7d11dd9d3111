package com.health.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.OptionalDouble;

/**
 * One user's measurements for one calendar day. Immutable; a correction is a
 * new sample with the same {@code (userId, date)} that replaces the old one.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "One day of health measurements for a single user")
public class MetricSample {

    @Schema(description = "User identifier", example = "USER-001")
    String userId;

    @Schema(description = "Calendar date the measurements belong to", example = "2026-10-17")
    LocalDate date;

    @Schema(description = "Step count", example = "6200")
    int steps;

    @Schema(description = "Distance walked in meters", example = "4650.0")
    double distanceMeters;

    @Schema(description = "Active calories burned", example = "310.5")
    double caloriesBurned;

    @Schema(description = "Screen time in minutes", example = "185")
    int screenTimeMinutes;

    @Schema(description = "Sleep duration in minutes (0-1440)", example = "430")
    int sleepDurationMinutes;

    @Schema(description = "Average heart rate in bpm, 0 when not recorded", example = "68.0")
    double averageHeartRate;

    @Schema(description = "Average HRV (SDNN) in ms, 0 when not recorded", example = "52.0")
    double averageHrv;

    @Schema(description = "Self-reported mood 1-10, absent when not logged", example = "7", nullable = true)
    Integer moodScore;

    /**
     * Value of the given metric for this day, or empty when it was not recorded.
     * Heart rate and HRV of 0 mean "no reading"; steps, sleep and screen time
     * zeros are real values.
     */
    public OptionalDouble metricValue(MetricType metricType) {
        return switch (metricType) {
            case STEPS -> OptionalDouble.of(steps);
            case DISTANCE -> OptionalDouble.of(distanceMeters);
            case CALORIES -> OptionalDouble.of(caloriesBurned);
            case SCREEN_TIME -> OptionalDouble.of(screenTimeMinutes);
            case SLEEP -> OptionalDouble.of(sleepDurationMinutes);
            case HEART_RATE -> averageHeartRate > 0 ? OptionalDouble.of(averageHeartRate) : OptionalDouble.empty();
            case HRV -> averageHrv > 0 ? OptionalDouble.of(averageHrv) : OptionalDouble.empty();
            case MOOD -> moodScore != null ? OptionalDouble.of(moodScore) : OptionalDouble.empty();
        };
    }

    public String recordKey() {
        return userId + ":" + date;
    }
}
