package com.health.anomaly.engine;

import com.health.anomaly.model.BaselineComputation;
import com.health.anomaly.model.MetricSample;
import com.health.anomaly.model.MetricType;
import com.health.anomaly.model.UserBaseline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Derives a {@link UserBaseline} from a window of daily samples.
 *
 * For each metric: arithmetic mean and population standard deviation over the
 * samples that actually recorded it. Heart rate and HRV zeros are "no reading"
 * and skipped; a metric with no readings at all is left out of the baseline.
 * Fewer than {@link UserBaseline#MIN_BASELINE_DAYS} samples yields
 * {@link BaselineComputation#insufficient}.
 */
@Component
public class BaselineCalculator {

    private static final Logger log = LoggerFactory.getLogger(BaselineCalculator.class);

    private final Clock clock;

    public BaselineCalculator(Clock clock) {
        this.clock = clock;
    }

    public BaselineComputation compute(List<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("At least one sample is required to compute a baseline");
        }

        String userId = samples.get(0).getUserId();
        for (MetricSample sample : samples) {
            if (!userId.equals(sample.getUserId())) {
                throw new IllegalArgumentException(String.format(
                        "Baseline window mixes users: expected %s but found %s on %s",
                        userId, sample.getUserId(), sample.getDate()));
            }
        }

        if (samples.size() < UserBaseline.MIN_BASELINE_DAYS) {
            log.debug("Insufficient data for {}: {} samples, need {}",
                    userId, samples.size(), UserBaseline.MIN_BASELINE_DAYS);
            return BaselineComputation.insufficient(userId, samples.size());
        }

        Map<MetricType, RunningStats> statsByMetric = new EnumMap<>(MetricType.class);
        for (MetricSample sample : samples) {
            for (MetricType metricType : MetricType.values()) {
                OptionalDouble value = sample.metricValue(metricType);
                if (value.isPresent()) {
                    statsByMetric.computeIfAbsent(metricType, t -> new RunningStats())
                            .add(value.getAsDouble());
                }
            }
        }

        UserBaseline.UserBaselineBuilder builder = UserBaseline.builder()
                .userId(userId)
                .sampleCount(samples.size())
                .calculatedAt(clock.instant());

        statsByMetric.forEach((metricType, stats) -> builder
                .mean(metricType, stats.getMean())
                .stdDev(metricType, stats.getPopulationStdDev()));

        return BaselineComputation.computed(builder.build());
    }
}
