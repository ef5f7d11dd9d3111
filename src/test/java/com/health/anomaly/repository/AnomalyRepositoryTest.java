package com.health.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.health.anomaly.model.AcknowledgementResult;
import com.health.anomaly.model.Anomaly;
import com.health.anomaly.model.MetricType;
import com.health.anomaly.model.Severity;
import com.health.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyRepositoryTest {

    @Mock private AerospikeClient client;

    private AnomalyRepository repository;

    @BeforeEach
    void setUp() {
        repository = new AnomalyRepository(client, "test", new WritePolicy(), new Policy());
    }

    @Test
    void acknowledge_newRecord_writesWithGenerationCheck() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(anomalyRecord("A-1", "U-1", false, 3, 0L));

        AcknowledgementResult result = repository.acknowledge("A-1", TestDataFactory.NOW);

        assertThat(result).isEqualTo(AcknowledgementResult.ACKNOWLEDGED);
        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        verify(client).put(policy.capture(), any(Key.class), any(Bin[].class));
        assertThat(policy.getValue().generationPolicy).isEqualTo(GenerationPolicy.EXPECT_GEN_EQUAL);
        assertThat(policy.getValue().generation).isEqualTo(3);
        assertThat(policy.getValue().recordExistsAction).isEqualTo(RecordExistsAction.UPDATE_ONLY);
    }

    @Test
    void acknowledge_alreadyAcknowledged_isNoOpSuccess() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(anomalyRecord("A-1", "U-1", true, 4, 1L));

        AcknowledgementResult result = repository.acknowledge("A-1", TestDataFactory.NOW);

        assertThat(result).isEqualTo(AcknowledgementResult.ALREADY_ACKNOWLEDGED);
        verify(client, never()).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
    }

    @Test
    void acknowledge_losingConcurrentRace_reReadsAndReportsAlreadyAcknowledged() {
        when(client.get(any(Policy.class), any(Key.class)))
                .thenReturn(anomalyRecord("A-1", "U-1", false, 3, 0L))
                .thenReturn(anomalyRecord("A-1", "U-1", true, 4, 1L));
        doThrow(new AerospikeException(ResultCode.GENERATION_ERROR))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        AcknowledgementResult result = repository.acknowledge("A-1", TestDataFactory.NOW);

        assertThat(result).isEqualTo(AcknowledgementResult.ALREADY_ACKNOWLEDGED);
        verify(client, times(2)).get(any(Policy.class), any(Key.class));
    }

    @Test
    void acknowledge_unknownId_isNotFound() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(null);

        assertThat(repository.acknowledge("MISSING", TestDataFactory.NOW))
                .isEqualTo(AcknowledgementResult.NOT_FOUND);
    }

    @Test
    void acknowledge_otherServerError_propagates() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(anomalyRecord("A-1", "U-1", false, 1, 0L));
        doThrow(new AerospikeException(ResultCode.TIMEOUT))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.acknowledge("A-1", TestDataFactory.NOW))
                .isInstanceOf(AerospikeException.class);
    }

    @Test
    void saveAll_keepsExistingRecordForSameId() {
        Anomaly steps = TestDataFactory.createAnomaly("U-1", MetricType.STEPS, Severity.ALERT, false);
        Anomaly sleep = TestDataFactory.createAnomaly("U-1", MetricType.SLEEP, Severity.WARNING, false);
        doNothing()
                .doThrow(new AerospikeException(ResultCode.KEY_EXISTS_ERROR))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        int inserted = repository.saveAll(List.of(steps, sleep));

        assertThat(inserted).isEqualTo(1);
        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        verify(client, times(2)).put(policy.capture(), any(Key.class), any(Bin[].class));
        assertThat(policy.getAllValues())
                .allSatisfy(p -> assertThat(p.recordExistsAction).isEqualTo(RecordExistsAction.CREATE_ONLY));
    }

    @Test
    void findRecent_isNewestFirstAndLimited() {
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            callback.scanCallback(null, anomalyRecord("A-1", "U-1", false, 1, 1000L));
            callback.scanCallback(null, anomalyRecord("A-2", "U-1", true, 1, 3000L));
            callback.scanCallback(null, anomalyRecord("A-3", "U-2", false, 1, 4000L));
            callback.scanCallback(null, anomalyRecord("A-4", "U-1", false, 1, 2000L));
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), anyString(), anyString(), any(ScanCallback.class));

        List<Anomaly> recent = repository.findRecent("U-1", 2);

        assertThat(recent).extracting(Anomaly::getId).containsExactly("A-2", "A-4");
        assertThat(recent.get(0).getDetectedAt()).isEqualTo(Instant.ofEpochMilli(3000L));
        assertThat(recent.get(0).isAcknowledged()).isTrue();
    }

    @Test
    void findUnacknowledged_filtersAcknowledged() {
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            callback.scanCallback(null, anomalyRecord("A-1", "U-1", false, 1, 1000L));
            callback.scanCallback(null, anomalyRecord("A-2", "U-1", true, 1, 3000L));
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), anyString(), anyString(), any(ScanCallback.class));

        assertThat(repository.findUnacknowledged("U-1")).extracting(Anomaly::getId).containsExactly("A-1");
    }

    private static Record anomalyRecord(String id, String userId, boolean acknowledged,
                                        int generation, long detectedAtMillis) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("id", id);
        bins.put("userId", userId);
        bins.put("date", "2026-10-01");
        bins.put("metricType", "STEPS");
        bins.put("category", "LOW_ACTIVITY");
        bins.put("detectedAt", detectedAtMillis);
        bins.put("actualValue", 2000.0);
        bins.put("expectedMin", 4000.0);
        bins.put("expectedMax", 8000.0);
        bins.put("severity", "ALERT");
        bins.put("message", "Your step count is significantly below your usual range.");
        bins.put("acknowledged", acknowledged);
        return new Record(bins, generation, 0);
    }
}
