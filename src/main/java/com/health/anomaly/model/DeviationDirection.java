package com.health.anomaly.model;

public enum DeviationDirection {
    BELOW,
    ABOVE;

    public static DeviationDirection of(double actualValue, double mean) {
        return actualValue < mean ? BELOW : ABOVE;
    }
}
