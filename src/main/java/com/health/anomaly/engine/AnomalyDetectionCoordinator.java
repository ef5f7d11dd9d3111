package com.health.anomaly.engine;

import com.health.anomaly.config.DetectionConfig;
import com.health.anomaly.model.Anomaly;
import com.health.anomaly.model.DetectionOutcome;
import com.health.anomaly.model.MetricSample;
import com.health.anomaly.model.MetricType;
import com.health.anomaly.model.MlSignalResult;
import com.health.anomaly.model.UserBaseline;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Chooses between the optional ML signal and the rule-based threshold detector.
 *
 * Flow:
 * 1. No valid baseline: empty outcome, reason {@code no_baseline}; nothing runs.
 * 2. ML signal present, successful and confident enough: its candidates are
 *    used as-is (one per metric), {@code usedFallback = false}.
 * 3. Otherwise the threshold detector runs and the reason is recorded:
 *    {@code ml_unavailable}, {@code ml_low_confidence} or {@code ml_error: ...}.
 *
 * Failures of the ML path (errors, exceptions, timeouts) never reach the caller.
 */
@Component
public class AnomalyDetectionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionCoordinator.class);

    private final ThresholdAnomalyDetector thresholdDetector;
    private final DetectionConfig config;
    private final Tracer tracer;
    private final ExecutorService mlExecutor;

    public AnomalyDetectionCoordinator(ThresholdAnomalyDetector thresholdDetector,
                                       DetectionConfig config,
                                       Tracer tracer,
                                       @Qualifier("mlSignalExecutor") ExecutorService mlExecutor) {
        this.thresholdDetector = thresholdDetector;
        this.config = config;
        this.tracer = tracer;
        this.mlExecutor = mlExecutor;
    }

    /**
     * Run detection with an ML result the caller already obtained.
     *
     * @param mlSignal the ML answer, or {@code null} when no model was consulted
     */
    public DetectionOutcome run(MetricSample sample, UserBaseline baseline, MlSignalResult mlSignal) {
        if (baseline == null || !baseline.isValid()) {
            log.debug("No valid baseline for {}, skipping detection for {}", sample.getUserId(), sample.getDate());
            return DetectionOutcome.noBaseline();
        }

        if (mlSignal == null) {
            return fallback(sample, baseline, DetectionOutcome.ML_UNAVAILABLE);
        }
        if (!mlSignal.isSuccess()) {
            String details = mlSignal.getFailureReason() != null ? mlSignal.getFailureReason() : "unknown failure";
            return fallback(sample, baseline, DetectionOutcome.ML_ERROR_PREFIX + details);
        }
        double threshold = config.getMl().getConfidenceThreshold();
        if (mlSignal.getConfidence() < threshold) {
            log.debug("ML confidence {} below threshold {} for {}", mlSignal.getConfidence(), threshold,
                    sample.getUserId());
            return fallback(sample, baseline, DetectionOutcome.ML_LOW_CONFIDENCE);
        }

        return DetectionOutcome.fromModel(onePerMetric(mlSignal.getCandidates()));
    }

    /**
     * Run detection, consulting the given provider first with a bounded wait.
     * A timeout is treated exactly like an ML failure.
     *
     * @param provider the ML source, or {@code null} when none is configured
     */
    public DetectionOutcome run(MetricSample sample, UserBaseline baseline,
                                MlSignalProvider provider, Duration timeout) {
        if (baseline == null || !baseline.isValid()) {
            return run(sample, baseline, (MlSignalResult) null);
        }
        if (provider == null) {
            return run(sample, baseline, (MlSignalResult) null);
        }

        Span mlSpan = tracer.nextSpan()
                .name("ml.signal.analyze")
                .tag("user.id", sample.getUserId())
                .tag("sample.date", String.valueOf(sample.getDate()))
                .start();

        MlSignalResult mlSignal;
        try (Tracer.SpanInScope ws = tracer.withSpan(mlSpan)) {
            mlSignal = invokeBounded(provider, sample, baseline, timeout);
            mlSpan.tag("ml.success", String.valueOf(mlSignal != null && mlSignal.isSuccess()));
        } finally {
            mlSpan.end();
        }

        return run(sample, baseline, mlSignal);
    }

    private MlSignalResult invokeBounded(MlSignalProvider provider, MetricSample sample,
                                         UserBaseline baseline, Duration timeout) {
        Future<MlSignalResult> future = null;
        try {
            future = mlExecutor.submit(() -> provider.analyze(sample, baseline));
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return MlSignalResult.failure("timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return MlSignalResult.failure(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return MlSignalResult.failure("interrupted while waiting for model");
        } catch (RuntimeException e) {
            return MlSignalResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private DetectionOutcome fallback(MetricSample sample, UserBaseline baseline, String reason) {
        log.warn("Using threshold fallback for user={}, date={}: {}", sample.getUserId(), sample.getDate(), reason);
        List<Anomaly> anomalies = thresholdDetector.detect(sample, baseline);
        return DetectionOutcome.fallback(anomalies, reason);
    }

    private List<Anomaly> onePerMetric(List<Anomaly> candidates) {
        Map<MetricType, Anomaly> byMetric = new EnumMap<>(MetricType.class);
        for (Anomaly candidate : candidates) {
            if (candidate.getMetricType() == null) continue;
            byMetric.putIfAbsent(candidate.getMetricType(), candidate);
        }
        return new ArrayList<>(byMetric.values());
    }
}
