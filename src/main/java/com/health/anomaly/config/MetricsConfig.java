package com.health.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetectionRun(boolean usedFallback, String fallbackReason) {
        Counter.builder("detection.run.count")
                .tag("fallback", String.valueOf(usedFallback))
                .tag("reason", reasonTag(fallbackReason))
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String metricType, String severity) {
        Counter.builder("anomaly.detected.count")
                .tag("metric", metricType)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordBaselineComputed(String outcome) {
        Counter.builder("baseline.computed.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAcknowledgement() {
        Counter.builder("anomaly.acknowledged.count")
                .register(registry)
                .increment();
    }

    // "ml_error: <details>" would explode tag cardinality
    private String reasonTag(String fallbackReason) {
        if (fallbackReason == null) return "none";
        int colon = fallbackReason.indexOf(':');
        return colon > 0 ? fallbackReason.substring(0, colon) : fallbackReason;
    }
}
