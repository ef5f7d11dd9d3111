package com.health.anomaly.config;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs optional ML calls so the coordinator can stop waiting on timeout.
     */
    @Bean(name = "mlSignalExecutor", destroyMethod = "shutdownNow")
    public ExecutorService mlSignalExecutor(DetectionConfig config) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(config.getMl().getExecutorThreads(), runnable -> {
            Thread thread = new Thread(runnable, "ml-signal-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }
}
