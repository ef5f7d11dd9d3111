package com.health.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.health.anomaly.config.AerospikeConfig;
import com.health.anomaly.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

@Repository
public class MetricSampleRepository {

    private static final Logger log = LoggerFactory.getLogger(MetricSampleRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public MetricSampleRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    /**
     * Stores a sample under {@code userId:date}. A second sample for the same
     * key replaces the first entirely.
     */
    public void save(MetricSample sample) {
        Key key = new Key(namespace, AerospikeConfig.SET_METRIC_SAMPLES, sample.recordKey());

        WritePolicy replacePolicy = new WritePolicy(writePolicy);
        replacePolicy.recordExistsAction = RecordExistsAction.REPLACE;

        client.put(replacePolicy, key,
                new Bin("userId", sample.getUserId()),
                new Bin("date", sample.getDate().toString()),
                new Bin("steps", sample.getSteps()),
                new Bin("distanceM", sample.getDistanceMeters()),
                new Bin("calories", sample.getCaloriesBurned()),
                new Bin("screenMin", sample.getScreenTimeMinutes()),
                new Bin("sleepMin", sample.getSleepDurationMinutes()),
                new Bin("avgHeartRate", sample.getAverageHeartRate()),
                new Bin("avgHrv", sample.getAverageHrv()),
                // mood is 1-10 when logged; 0 marks "not logged"
                new Bin("moodScore", sample.getMoodScore() != null ? sample.getMoodScore() : 0));
    }

    /**
     * Most recent {@code days} samples for a user, ascending by date.
     */
    public List<MetricSample> findWindow(String userId, int days) {
        List<MetricSample> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_METRIC_SAMPLES,
                (key, record) -> {
                    try {
                        if (!userId.equals(record.getString("userId"))) return;
                        MetricSample sample = mapRecord(record);
                        synchronized (results) {
                            results.add(sample);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read metric sample record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparing(MetricSample::getDate));
        if (results.size() <= days) return results;
        return new ArrayList<>(results.subList(results.size() - days, results.size()));
    }

    public Set<String> findAllUserIds() {
        Set<String> userIds = new TreeSet<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_METRIC_SAMPLES,
                (key, record) -> {
                    String userId = record.getString("userId");
                    if (userId != null) {
                        synchronized (userIds) {
                            userIds.add(userId);
                        }
                    }
                }, "userId");
        return userIds;
    }

    /**
     * Atomically bump the number of samples ingested since the user's last
     * baseline recompute and return the new value.
     */
    public long incrementSamplesSinceBaseline(String userId) {
        Key key = new Key(namespace, AerospikeConfig.SET_SAMPLE_COUNTERS, userId);
        Record record = client.operate(writePolicy, key,
                Operation.add(new Bin("sinceBase", 1)),
                Operation.get("sinceBase"));
        return record.getLong("sinceBase");
    }

    public void resetSamplesSinceBaseline(String userId) {
        Key key = new Key(namespace, AerospikeConfig.SET_SAMPLE_COUNTERS, userId);
        client.put(writePolicy, key, new Bin("sinceBase", 0));
    }

    private MetricSample mapRecord(Record record) {
        int mood = record.getInt("moodScore");
        return MetricSample.builder()
                .userId(record.getString("userId"))
                .date(LocalDate.parse(record.getString("date")))
                .steps(record.getInt("steps"))
                .distanceMeters(record.getDouble("distanceM"))
                .caloriesBurned(record.getDouble("calories"))
                .screenTimeMinutes(record.getInt("screenMin"))
                .sleepDurationMinutes(record.getInt("sleepMin"))
                .averageHeartRate(record.getDouble("avgHeartRate"))
                .averageHrv(record.getDouble("avgHrv"))
                .moodScore(mood > 0 ? mood : null)
                .build();
    }
}
