package com.health.anomaly.service;

import com.health.anomaly.config.MetricsConfig;
import com.health.anomaly.model.AcknowledgementResult;
import com.health.anomaly.model.Anomaly;
import com.health.anomaly.repository.AnomalyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Owns the NEW -> ACKNOWLEDGED lifecycle of stored anomalies. Acknowledgement is
 * one-way and idempotent; concurrent calls for the same id leave exactly one
 * transition behind.
 */
@Service
public class AcknowledgementTracker {

    private static final Logger log = LoggerFactory.getLogger(AcknowledgementTracker.class);

    private final AnomalyRepository anomalyRepo;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AcknowledgementTracker(AnomalyRepository anomalyRepo,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.anomalyRepo = anomalyRepo;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Store freshly detected anomalies. An anomaly already stored under the same
     * id keeps its existing state.
     */
    public int register(List<Anomaly> anomalies) {
        if (anomalies == null || anomalies.isEmpty()) return 0;
        int inserted = anomalyRepo.saveAll(anomalies);
        if (inserted < anomalies.size()) {
            log.debug("Registered {} of {} anomalies, the rest were already stored",
                    inserted, anomalies.size());
        }
        return inserted;
    }

    public AcknowledgementResult acknowledge(String anomalyId) {
        AcknowledgementResult result = anomalyRepo.acknowledge(anomalyId, clock.instant());
        switch (result) {
            case ACKNOWLEDGED -> {
                metricsConfig.recordAcknowledgement();
                log.info("Anomaly acknowledged: id={}", anomalyId);
            }
            case ALREADY_ACKNOWLEDGED -> log.debug("Anomaly {} was already acknowledged", anomalyId);
            case NOT_FOUND -> log.warn("Cannot acknowledge anomaly {}: not found", anomalyId);
        }
        return result;
    }

    public Anomaly findById(String anomalyId) {
        return anomalyRepo.findById(anomalyId);
    }

    public List<Anomaly> findUnacknowledged(String userId) {
        return anomalyRepo.findUnacknowledged(userId);
    }

    public List<Anomaly> findForDate(String userId, LocalDate date) {
        return anomalyRepo.findByUserAndDate(userId, date);
    }

    public List<Anomaly> findRecent(String userId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return anomalyRepo.findRecent(userId, limit);
    }
}
