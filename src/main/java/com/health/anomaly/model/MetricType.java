package com.health.anomaly.model;

/**
 * Daily health metrics tracked per user.
 *
 * {@code minimumDelta} is the absolute floor used when a metric showed no
 * variance in the baseline window: a value must differ from the mean by more
 * than {@code max(1% of |mean|, minimumDelta)} to be flagged.
 */
public enum MetricType {
    STEPS("step count", "steps", 1.0),
    DISTANCE("distance", "m", 1.0),
    CALORIES("calories burned", "kcal", 1.0),
    SCREEN_TIME("screen time", "min", 1.0),
    SLEEP("sleep duration", "min", 1.0),
    HEART_RATE("average heart rate", "bpm", 1.0),
    HRV("heart-rate variability", "ms", 1.0),
    MOOD("mood score", "/10", 0.5);

    private static final double RELATIVE_TOLERANCE = 0.01;

    private final String label;
    private final String unit;
    private final double minimumDelta;

    MetricType(String label, String unit, double minimumDelta) {
        this.label = label;
        this.unit = unit;
        this.minimumDelta = minimumDelta;
    }

    public String getLabel() {
        return label;
    }

    public String getUnit() {
        return unit;
    }

    public double getMinimumDelta() {
        return minimumDelta;
    }

    public double zeroVarianceTolerance(double mean) {
        return Math.max(Math.abs(mean) * RELATIVE_TOLERANCE, minimumDelta);
    }

    /**
     * Renders a value in the metric's natural unit, e.g. {@code 7h 30m} for sleep.
     */
    public String format(double value) {
        return switch (this) {
            case SCREEN_TIME, SLEEP -> {
                long minutes = Math.round(value);
                yield String.format("%dh %dm", minutes / 60, Math.abs(minutes % 60));
            }
            case STEPS, CALORIES -> String.format("%d %s", Math.round(value), unit);
            case MOOD -> String.format("%.1f%s", value, unit);
            default -> String.format("%.0f %s", value, unit);
        };
    }
}
