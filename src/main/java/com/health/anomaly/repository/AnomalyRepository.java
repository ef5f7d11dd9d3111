package com.health.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.health.anomaly.config.AerospikeConfig;
import com.health.anomaly.model.AcknowledgementResult;
import com.health.anomaly.model.Anomaly;
import com.health.anomaly.model.AnomalyCategory;
import com.health.anomaly.model.MetricType;
import com.health.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

@Repository
public class AnomalyRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRepository.class);

    static final int MAX_CAS_ATTEMPTS = 5;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AnomalyRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * Inserts each anomaly unless a record with the same id already exists, in
     * which case the stored record (and its acknowledgement) is kept.
     *
     * @return number of anomalies actually inserted
     */
    public int saveAll(List<Anomaly> anomalies) {
        WritePolicy createPolicy = new WritePolicy(writePolicy);
        createPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        int inserted = 0;
        for (Anomaly anomaly : anomalies) {
            Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomaly.getId());
            try {
                client.put(createPolicy, key,
                        new Bin("id", anomaly.getId()),
                        new Bin("userId", anomaly.getUserId()),
                        new Bin("date", String.valueOf(anomaly.getDate())),
                        new Bin("metricType", anomaly.getMetricType().name()),
                        new Bin("category", anomaly.getCategory() != null ? anomaly.getCategory().name() : ""),
                        new Bin("detectedAt", anomaly.getDetectedAt().toEpochMilli()),
                        new Bin("actualValue", anomaly.getActualValue()),
                        new Bin("expectedMin", anomaly.getExpectedMin()),
                        new Bin("expectedMax", anomaly.getExpectedMax()),
                        new Bin("severity", anomaly.getSeverity().name()),
                        new Bin("message", anomaly.getMessage()),
                        new Bin("acknowledged", anomaly.isAcknowledged()),
                        new Bin("ackAt", 0L));
                inserted++;
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.KEY_EXISTS_ERROR) throw e;
                log.debug("Anomaly {} already stored for user={} metric={}, keeping existing record",
                        anomaly.getId(), anomaly.getUserId(), anomaly.getMetricType());
            }
        }
        return inserted;
    }

    public Anomaly findById(String anomalyId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomalyId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * NEW -> ACKNOWLEDGED as a generation-checked compare-and-set. A concurrent
     * acknowledgement makes the write fail with GENERATION_ERROR; the re-read
     * then sees the record already acknowledged.
     */
    public AcknowledgementResult acknowledge(String anomalyId, Instant acknowledgedAt) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomalyId);

        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Record record = client.get(readPolicy, key);
            if (record == null) return AcknowledgementResult.NOT_FOUND;
            if (record.getBoolean("acknowledged")) return AcknowledgementResult.ALREADY_ACKNOWLEDGED;

            WritePolicy casPolicy = new WritePolicy(writePolicy);
            casPolicy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
            casPolicy.generation = record.generation;
            casPolicy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;

            try {
                client.put(casPolicy, key,
                        new Bin("acknowledged", true),
                        new Bin("ackAt", acknowledgedAt.toEpochMilli()));
                return AcknowledgementResult.ACKNOWLEDGED;
            } catch (AerospikeException e) {
                if (e.getResultCode() == ResultCode.KEY_NOT_FOUND_ERROR) return AcknowledgementResult.NOT_FOUND;
                if (e.getResultCode() != ResultCode.GENERATION_ERROR) throw e;
                log.debug("Concurrent update on anomaly {} (attempt {}), re-reading", anomalyId, attempt);
            }
        }

        throw new IllegalStateException(
                "Could not acknowledge anomaly " + anomalyId + " after " + MAX_CAS_ATTEMPTS + " attempts");
    }

    public List<Anomaly> findByUserAndDate(String userId, LocalDate date) {
        String dateStr = date.toString();
        return scanForUser(userId, a -> dateStr.equals(String.valueOf(a.getDate())));
    }

    public List<Anomaly> findUnacknowledged(String userId) {
        return scanForUser(userId, a -> !a.isAcknowledged());
    }

    public List<Anomaly> findRecent(String userId, int limit) {
        List<Anomaly> all = scanForUser(userId, a -> true);
        return all.size() <= limit ? all : new ArrayList<>(all.subList(0, limit));
    }

    /** Matching anomalies for the user, newest first. */
    private List<Anomaly> scanForUser(String userId, Predicate<Anomaly> filter) {
        List<Anomaly> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    try {
                        if (!userId.equals(record.getString("userId"))) return;
                        Anomaly anomaly = mapRecord(record);
                        if (!filter.test(anomaly)) return;
                        synchronized (results) {
                            results.add(anomaly);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read anomaly record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparing(Anomaly::getDetectedAt).reversed()
                .thenComparing(Anomaly::getMetricType));
        return results;
    }

    private Anomaly mapRecord(Record record) {
        String category = record.getString("category");
        return Anomaly.builder()
                .id(record.getString("id"))
                .userId(record.getString("userId"))
                .date(LocalDate.parse(record.getString("date")))
                .metricType(MetricType.valueOf(record.getString("metricType")))
                .category(category != null && !category.isEmpty() ? AnomalyCategory.valueOf(category) : null)
                .detectedAt(Instant.ofEpochMilli(record.getLong("detectedAt")))
                .actualValue(record.getDouble("actualValue"))
                .expectedMin(record.getDouble("expectedMin"))
                .expectedMax(record.getDouble("expectedMax"))
                .severity(Severity.valueOf(record.getString("severity")))
                .message(record.getString("message"))
                .acknowledged(record.getBoolean("acknowledged"))
                .build();
    }
}
