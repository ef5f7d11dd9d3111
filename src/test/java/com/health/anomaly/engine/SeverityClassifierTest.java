package com.health.anomaly.engine;

import com.health.anomaly.model.Severity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityClassifierTest {

    @Test
    void warningBoundaries() {
        assertThat(SeverityClassifier.classify(2.0)).isEqualTo(Severity.WARNING);
        assertThat(SeverityClassifier.classify(2.5)).isEqualTo(Severity.WARNING);
        assertThat(SeverityClassifier.classify(2.999)).isEqualTo(Severity.WARNING);
    }

    @Test
    void alertBoundaries() {
        assertThat(SeverityClassifier.classify(3.0)).isEqualTo(Severity.ALERT);
        assertThat(SeverityClassifier.classify(4.0)).isEqualTo(Severity.ALERT);
        assertThat(SeverityClassifier.classify(100.0)).isEqualTo(Severity.ALERT);
    }

    @Test
    void negativeZScores_useMagnitude() {
        assertThat(SeverityClassifier.classify(-2.0)).isEqualTo(Severity.WARNING);
        assertThat(SeverityClassifier.classify(-2.999)).isEqualTo(Severity.WARNING);
        assertThat(SeverityClassifier.classify(-3.0)).isEqualTo(Severity.ALERT);
    }

    @Test
    void belowWarning_isInfo() {
        assertThat(SeverityClassifier.classify(0.0)).isEqualTo(Severity.INFO);
        assertThat(SeverityClassifier.classify(1.999)).isEqualTo(Severity.INFO);
    }
}
