package com.health.anomaly.model;

/**
 * Human-readable classification of a deviation, chosen from the metric and the
 * direction in which the value left its expected range.
 *
 * A category that is not {@code concerning} describes a favourable change
 * (more activity, less screen time) and is reported at {@link Severity#INFO}.
 */
public enum AnomalyCategory {
    LOW_ACTIVITY(true, "is significantly below"),
    HIGH_ACTIVITY(false, "is well above"),
    LOW_ENERGY_EXPENDITURE(true, "is significantly below"),
    HIGH_ENERGY_EXPENDITURE(false, "is well above"),
    EXCESSIVE_SCREEN_TIME(true, "is higher than"),
    REDUCED_SCREEN_TIME(false, "is lower than"),
    SLEEP_DEFICIT(true, "is shorter than"),
    EXCESSIVE_SLEEP(true, "is longer than"),
    ELEVATED_HEART_RATE(true, "is elevated compared to"),
    LOW_HEART_RATE(false, "is lower than"),
    HIGH_STRESS(true, "is below"),
    ELEVATED_HRV(false, "is above"),
    LOW_MOOD(true, "is below"),
    ELEVATED_MOOD(false, "is above");

    private final boolean concerning;
    private final String phrase;

    AnomalyCategory(boolean concerning, String phrase) {
        this.concerning = concerning;
        this.phrase = phrase;
    }

    public boolean isConcerning() {
        return concerning;
    }

    public String describe(MetricType metricType, double actualValue, double expectedMin, double expectedMax) {
        String range = expectedMin == expectedMax
                ? "your usual value of " + metricType.format(expectedMin)
                : "your usual range (" + metricType.format(expectedMin) + " - " + metricType.format(expectedMax) + ")";
        String sentence = String.format("Your %s (%s) %s %s.",
                metricType.getLabel(), metricType.format(actualValue), phrase, range);
        if (this == HIGH_STRESS) {
            sentence += " This can indicate elevated stress; consider taking a break.";
        }
        return sentence;
    }
}
