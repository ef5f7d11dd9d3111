package com.health.anomaly.service;

import com.health.anomaly.config.DetectionConfig;
import com.health.anomaly.config.MetricsConfig;
import com.health.anomaly.engine.BaselineCalculator;
import com.health.anomaly.model.BaselineComputation;
import com.health.anomaly.model.MetricSample;
import com.health.anomaly.model.UserBaseline;
import com.health.anomaly.repository.MetricSampleRepository;
import com.health.anomaly.repository.UserBaselineRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    private final BaselineCalculator calculator;
    private final MetricSampleRepository sampleRepo;
    private final UserBaselineRepository baselineRepo;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public BaselineService(BaselineCalculator calculator,
                           MetricSampleRepository sampleRepo,
                           UserBaselineRepository baselineRepo,
                           DetectionConfig config,
                           MetricsConfig metricsConfig) {
        this.calculator = calculator;
        this.sampleRepo = sampleRepo;
        this.baselineRepo = baselineRepo;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Recompute the user's baseline from the configured rolling window and store
     * it. With too few samples nothing is stored and the previous baseline (if
     * any) stays in place.
     */
    @Observed(name = "baseline.recompute", contextualName = "recompute-baseline")
    public BaselineComputation recompute(String userId) {
        List<MetricSample> window = sampleRepo.findWindow(userId, config.getBaselineWindowDays());
        if (window.isEmpty()) {
            log.debug("No samples stored for user {}, baseline not computed", userId);
            metricsConfig.recordBaselineComputed("insufficient_data");
            return BaselineComputation.insufficient(userId, 0);
        }

        BaselineComputation computation = calculator.compute(window);
        Optional<UserBaseline> baseline = computation.asBaseline();
        if (baseline.isEmpty()) {
            metricsConfig.recordBaselineComputed("insufficient_data");
            return computation;
        }

        baselineRepo.save(baseline.get());
        sampleRepo.resetSamplesSinceBaseline(userId);
        metricsConfig.recordBaselineComputed("computed");
        log.info("Baseline recomputed for user={} from {} samples", userId, computation.getSampleCount());
        return computation;
    }

    @Scheduled(cron = "${health.baseline-refresh.cron:0 0 2 * * *}")
    public void recomputeAll() {
        if (!config.getBaselineRefresh().isEnabled()) return;

        Set<String> userIds = sampleRepo.findAllUserIds();
        log.info("Nightly baseline refresh starting for {} users", userIds.size());
        int computed = 0;
        for (String userId : userIds) {
            try {
                if (!recompute(userId).isInsufficientData()) computed++;
            } catch (RuntimeException e) {
                log.error("Baseline refresh failed for user={}: {}", userId, e.getMessage(), e);
            }
        }
        log.info("Nightly baseline refresh finished: {}/{} users have a fresh baseline", computed, userIds.size());
    }

    public UserBaseline getBaseline(String userId) {
        return baselineRepo.findByUserId(userId);
    }

    public boolean hasValidBaseline(String userId) {
        UserBaseline baseline = baselineRepo.findByUserId(userId);
        return baseline != null && baseline.isValid();
    }
}
