package com.health.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "health")
public class DetectionConfig {

    // Rolling window (days) handed to the baseline calculator.
    private int baselineWindowDays = 30;

    // Recompute a user's baseline once this many samples arrived since the last one.
    private int recomputeAfterSamples = 7;

    private Ml ml = new Ml();

    private BaselineRefresh baselineRefresh = new BaselineRefresh();

    @Data
    public static class Ml {
        // Results below this confidence are treated as failures (ml_low_confidence).
        private double confidenceThreshold = 0.7;
        private long timeoutMs = 200;
        private int executorThreads = 4;
    }

    @Data
    public static class BaselineRefresh {
        private boolean enabled = true;
        private String cron = "0 0 2 * * *";
    }
}
