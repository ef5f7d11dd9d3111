package com.health.anomaly.service;

import com.health.anomaly.config.DetectionConfig;
import com.health.anomaly.config.MetricsConfig;
import com.health.anomaly.engine.AnomalyDetectionCoordinator;
import com.health.anomaly.engine.MlSignalProvider;
import com.health.anomaly.model.Anomaly;
import com.health.anomaly.model.DetectionOutcome;
import com.health.anomaly.model.MetricSample;
import com.health.anomaly.model.Severity;
import com.health.anomaly.model.UserBaseline;
import com.health.anomaly.repository.UserBaselineRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Entry point for running detection on one daily sample.
 *
 * Flow:
 * 1. Load the user's stored baseline (an invalid one counts as absent)
 * 2. Let the coordinator consult the ML provider, if one is deployed, or fall back
 *    to the threshold detector
 * 3. Register the resulting anomalies for acknowledgement
 * 4. Record metrics and return the outcome
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final UserBaselineRepository baselineRepo;
    private final AnomalyDetectionCoordinator coordinator;
    private final ObjectProvider<MlSignalProvider> mlSignalProvider;
    private final AcknowledgementTracker acknowledgementTracker;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(UserBaselineRepository baselineRepo,
                                   AnomalyDetectionCoordinator coordinator,
                                   ObjectProvider<MlSignalProvider> mlSignalProvider,
                                   AcknowledgementTracker acknowledgementTracker,
                                   DetectionConfig config,
                                   MetricsConfig metricsConfig) {
        this.baselineRepo = baselineRepo;
        this.coordinator = coordinator;
        this.mlSignalProvider = mlSignalProvider;
        this.acknowledgementTracker = acknowledgementTracker;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "anomaly.detect", contextualName = "detect-anomalies")
    public DetectionOutcome detect(MetricSample sample) {
        MetricSampleService.validate(sample);

        UserBaseline baseline = baselineRepo.findByUserId(sample.getUserId());
        DetectionOutcome outcome = coordinator.run(sample, baseline,
                mlSignalProvider.getIfAvailable(),
                Duration.ofMillis(config.getMl().getTimeoutMs()));

        metricsConfig.recordDetectionRun(outcome.isUsedFallback(), outcome.getFallbackReason());
        if (outcome.getAnomalies().isEmpty()) {
            return outcome;
        }

        acknowledgementTracker.register(outcome.getAnomalies());
        for (Anomaly anomaly : outcome.getAnomalies()) {
            metricsConfig.recordAnomaly(anomaly.getMetricType().name(), String.valueOf(anomaly.getSeverity()));
            if (anomaly.getSeverity() == Severity.ALERT) {
                log.warn("ALERT anomaly for user={}, date={}, metric={}: {}",
                        anomaly.getUserId(), anomaly.getDate(), anomaly.getMetricType(), anomaly.getMessage());
            }
        }
        return outcome;
    }
}
