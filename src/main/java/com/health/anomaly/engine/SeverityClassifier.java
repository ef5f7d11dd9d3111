package com.health.anomaly.engine;

import com.health.anomaly.model.Severity;

/**
 * Maps a z-score magnitude to a severity tier.
 * {@code 2.0 <= |z| < 3.0} is WARNING, {@code |z| >= 3.0} is ALERT, anything
 * smaller is INFO.
 */
public final class SeverityClassifier {

    public static final double WARNING_Z = 2.0;
    public static final double ALERT_Z = 3.0;

    private SeverityClassifier() {}

    public static Severity classify(double zScore) {
        double magnitude = Math.abs(zScore);
        if (magnitude >= ALERT_Z) return Severity.ALERT;
        if (magnitude >= WARNING_Z) return Severity.WARNING;
        return Severity.INFO;
    }
}
