package com.health.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.health.anomaly.config.AerospikeConfig;
import com.health.anomaly.model.MetricType;
import com.health.anomaly.model.UserBaseline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

@Repository
public class UserBaselineRepository {

    private static final Logger log = LoggerFactory.getLogger(UserBaselineRepository.class);

    private static final TypeReference<Map<MetricType, Double>> METRIC_MAP = new TypeReference<>() {};

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public UserBaselineRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Replaces any previous baseline for the user in a single record write
     * (last write wins).
     */
    public void save(UserBaseline baseline) {
        Key key = new Key(namespace, AerospikeConfig.SET_USER_BASELINES, baseline.getUserId());

        WritePolicy replacePolicy = new WritePolicy(writePolicy);
        replacePolicy.recordExistsAction = RecordExistsAction.REPLACE;

        client.put(replacePolicy, key,
                new Bin("userId", baseline.getUserId()),
                new Bin("means", serializeMap(baseline.getPerMetricMean())),
                new Bin("stdDevs", serializeMap(baseline.getPerMetricStdDev())),
                new Bin("sampleCount", baseline.getSampleCount()),
                new Bin("calculatedAt", baseline.getCalculatedAt().toEpochMilli()));
    }

    public UserBaseline findByUserId(String userId) {
        Key key = new Key(namespace, AerospikeConfig.SET_USER_BASELINES, userId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;

        try {
            return UserBaseline.builder()
                    .userId(record.getString("userId"))
                    .perMetricMean(deserializeMap(record.getString("means")))
                    .perMetricStdDev(deserializeMap(record.getString("stdDevs")))
                    .sampleCount(record.getInt("sampleCount"))
                    .calculatedAt(Instant.ofEpochMilli(record.getLong("calculatedAt")))
                    .build();
        } catch (JsonProcessingException e) {
            // an unreadable baseline is treated as absent rather than as an empty one
            log.error("Unreadable baseline record for {}", userId, e);
            return null;
        }
    }

    private String serializeMap(Map<MetricType, Double> map) {
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize baseline statistics", e);
        }
    }

    private Map<MetricType, Double> deserializeMap(String json) throws JsonProcessingException {
        if (json == null || json.isEmpty()) return new EnumMap<>(MetricType.class);
        return objectMapper.readValue(json, METRIC_MAP);
    }
}
