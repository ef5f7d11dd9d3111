package com.health.anomaly.engine;

import com.health.anomaly.model.Anomaly;
import com.health.anomaly.model.AnomalyCategory;
import com.health.anomaly.model.DeviationDirection;
import com.health.anomaly.model.MetricSample;
import com.health.anomaly.model.MetricType;
import com.health.anomaly.model.Severity;
import com.health.anomaly.model.UserBaseline;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Rule-based detector: flags a metric when its value is more than
 * {@link #THRESHOLD_STD_DEV} standard deviations away from the user's mean.
 *
 * Logic per metric present in both the sample and the baseline:
 *   stdDev == 0 : flag at WARNING when |value - mean| exceeds the metric's
 *                 zero-variance tolerance; expected range collapses to the mean.
 *   otherwise   : z = (value - mean) / stdDev, flag when |z| > 2.0 (strict);
 *                 expected range is mean +/- 2.0 * stdDev.
 *
 * Severity comes from {@link SeverityClassifier}, except that deviations in a
 * favourable direction (see {@link AnomalyCategory#isConcerning()}) are INFO.
 * At most one anomaly per metric; output order follows {@link MetricType}.
 */
@Component
public class ThresholdAnomalyDetector {

    public static final double THRESHOLD_STD_DEV = 2.0;

    private final Clock clock;

    public ThresholdAnomalyDetector(Clock clock) {
        this.clock = clock;
    }

    public List<Anomaly> detect(MetricSample sample, UserBaseline baseline) {
        if (baseline == null) {
            throw new PreconditionViolationException(
                    "Threshold detection invoked without a baseline for user " + sample.getUserId());
        }
        if (!baseline.isValid()) {
            throw new PreconditionViolationException(String.format(
                    "Baseline for %s has %d samples; at least %d are required before detection",
                    baseline.getUserId(), baseline.getSampleCount(), UserBaseline.MIN_BASELINE_DAYS));
        }
        if (!baseline.getUserId().equals(sample.getUserId())) {
            throw new PreconditionViolationException(String.format(
                    "Baseline belongs to %s but sample belongs to %s",
                    baseline.getUserId(), sample.getUserId()));
        }

        Instant detectedAt = clock.instant();
        List<Anomaly> anomalies = new ArrayList<>();

        for (MetricType metricType : MetricType.values()) {
            OptionalDouble value = sample.metricValue(metricType);
            if (value.isEmpty() || !baseline.covers(metricType)) {
                continue;
            }
            evaluate(sample, metricType, value.getAsDouble(),
                    baseline.meanOf(metricType), baseline.stdDevOf(metricType), detectedAt)
                    .ifPresent(anomalies::add);
        }

        return anomalies;
    }

    private Optional<Anomaly> evaluate(MetricSample sample, MetricType metricType, double actualValue,
                                       double mean, double stdDev, Instant detectedAt) {
        if (stdDev == 0.0) {
            double tolerance = metricType.zeroVarianceTolerance(mean);
            if (Math.abs(actualValue - mean) <= tolerance) {
                return Optional.empty();
            }
            return Optional.of(buildAnomaly(sample, metricType, actualValue, mean, mean, mean,
                    Severity.WARNING, detectedAt));
        }

        double zScore = (actualValue - mean) / stdDev;
        if (Math.abs(zScore) <= THRESHOLD_STD_DEV) {
            return Optional.empty();
        }

        double expectedMin = mean - THRESHOLD_STD_DEV * stdDev;
        double expectedMax = mean + THRESHOLD_STD_DEV * stdDev;
        // rounding can leave a value with |z| just over 2.0 on the boundary itself
        if (actualValue >= expectedMin && actualValue <= expectedMax) {
            return Optional.empty();
        }

        AnomalyCategory category = DeviationCategoryTable.categorize(
                metricType, DeviationDirection.of(actualValue, mean));
        Severity severity = category.isConcerning() ? SeverityClassifier.classify(zScore) : Severity.INFO;

        return Optional.of(buildAnomaly(sample, metricType, actualValue, mean, expectedMin, expectedMax,
                severity, detectedAt));
    }

    private Anomaly buildAnomaly(MetricSample sample, MetricType metricType, double actualValue, double mean,
                                 double expectedMin, double expectedMax, Severity severity, Instant detectedAt) {
        AnomalyCategory category = DeviationCategoryTable.categorize(
                metricType, DeviationDirection.of(actualValue, mean));

        return Anomaly.builder()
                .id(Anomaly.idFor(sample.getUserId(), sample.getDate(), metricType))
                .userId(sample.getUserId())
                .date(sample.getDate())
                .metricType(metricType)
                .category(category)
                .detectedAt(detectedAt)
                .actualValue(actualValue)
                .expectedMin(expectedMin)
                .expectedMax(expectedMax)
                .severity(severity)
                .message(category.describe(metricType, actualValue, expectedMin, expectedMax))
                .acknowledged(false)
                .build();
    }
}
