package com.health.anomaly.service;

import com.health.anomaly.config.DetectionConfig;
import com.health.anomaly.model.MetricSample;
import com.health.anomaly.repository.MetricSampleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class MetricSampleService {

    private static final Logger log = LoggerFactory.getLogger(MetricSampleService.class);

    static final int MINUTES_PER_DAY = 1440;

    private final MetricSampleRepository sampleRepo;
    private final BaselineService baselineService;
    private final DetectionConfig config;

    public MetricSampleService(MetricSampleRepository sampleRepo,
                               BaselineService baselineService,
                               DetectionConfig config) {
        this.sampleRepo = sampleRepo;
        this.baselineService = baselineService;
        this.config = config;
    }

    /**
     * Store a daily sample (replacing any earlier one for the same day) and
     * recompute the user's baseline once enough new samples have arrived.
     */
    public MetricSample ingest(MetricSample sample) {
        validate(sample);
        sampleRepo.save(sample);

        long sinceBaseline = sampleRepo.incrementSamplesSinceBaseline(sample.getUserId());
        if (sinceBaseline >= config.getRecomputeAfterSamples()) {
            log.debug("{} samples since last baseline for user {}, recomputing", sinceBaseline, sample.getUserId());
            baselineService.recompute(sample.getUserId());
        }
        return sample;
    }

    public List<MetricSample> getWindow(String userId, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        return sampleRepo.findWindow(userId, days);
    }

    static void validate(MetricSample sample) {
        if (sample == null) throw new IllegalArgumentException("sample is required");
        if (sample.getUserId() == null || sample.getUserId().isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (sample.getDate() == null) throw new IllegalArgumentException("date is required");
        if (sample.getSteps() < 0) throw new IllegalArgumentException("steps must not be negative");
        if (sample.getDistanceMeters() < 0) throw new IllegalArgumentException("distanceMeters must not be negative");
        if (sample.getCaloriesBurned() < 0) throw new IllegalArgumentException("caloriesBurned must not be negative");
        if (sample.getScreenTimeMinutes() < 0) {
            throw new IllegalArgumentException("screenTimeMinutes must not be negative");
        }
        if (sample.getSleepDurationMinutes() < 0 || sample.getSleepDurationMinutes() > MINUTES_PER_DAY) {
            throw new IllegalArgumentException("sleepDurationMinutes must be between 0 and " + MINUTES_PER_DAY);
        }
        if (sample.getAverageHeartRate() < 0) throw new IllegalArgumentException("averageHeartRate must not be negative");
        if (sample.getAverageHrv() < 0) throw new IllegalArgumentException("averageHrv must not be negative");
        Integer mood = sample.getMoodScore();
        if (mood != null && (mood < 1 || mood > 10)) {
            throw new IllegalArgumentException("moodScore must be between 1 and 10");
        }
    }
}
