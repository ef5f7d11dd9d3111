package com.health.anomaly.service;

import com.health.anomaly.config.DetectionConfig;
import com.health.anomaly.config.MetricsConfig;
import com.health.anomaly.engine.BaselineCalculator;
import com.health.anomaly.model.BaselineComputation;
import com.health.anomaly.model.MetricType;
import com.health.anomaly.model.UserBaseline;
import com.health.anomaly.repository.MetricSampleRepository;
import com.health.anomaly.repository.UserBaselineRepository;
import com.health.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BaselineServiceTest {

    @Mock private MetricSampleRepository sampleRepo;
    @Mock private UserBaselineRepository baselineRepo;
    @Mock private MetricsConfig metricsConfig;

    private DetectionConfig config;
    private BaselineService service;

    @BeforeEach
    void setUp() {
        config = new DetectionConfig();
        service = new BaselineService(new BaselineCalculator(TestDataFactory.FIXED_CLOCK),
                sampleRepo, baselineRepo, config, metricsConfig);
    }

    @Test
    void recompute_withEnoughSamples_savesBaselineAndResetsCounter() {
        when(sampleRepo.findWindow("U-1", 30)).thenReturn(TestDataFactory.createSamples("U-1", 14));

        BaselineComputation result = service.recompute("U-1");

        assertThat(result.isInsufficientData()).isFalse();
        ArgumentCaptor<UserBaseline> captor = ArgumentCaptor.forClass(UserBaseline.class);
        verify(baselineRepo).save(captor.capture());
        assertThat(captor.getValue().getSampleCount()).isEqualTo(14);
        assertThat(captor.getValue().meanOf(MetricType.STEPS)).isEqualTo(6000.0);
        verify(sampleRepo).resetSamplesSinceBaseline("U-1");
        verify(metricsConfig).recordBaselineComputed("computed");
    }

    @Test
    void recompute_usesConfiguredWindow() {
        config.setBaselineWindowDays(14);
        when(sampleRepo.findWindow("U-1", 14)).thenReturn(TestDataFactory.createSamples("U-1", 14));

        service.recompute("U-1");

        verify(sampleRepo).findWindow("U-1", 14);
    }

    @Test
    void recompute_withTooFewSamples_keepsPreviousBaseline() {
        when(sampleRepo.findWindow("U-1", 30)).thenReturn(TestDataFactory.createSamples("U-1", 4));

        BaselineComputation result = service.recompute("U-1");

        assertThat(result.isInsufficientData()).isTrue();
        assertThat(result.getSampleCount()).isEqualTo(4);
        verify(baselineRepo, never()).save(any());
        verify(sampleRepo, never()).resetSamplesSinceBaseline(anyString());
        verify(metricsConfig).recordBaselineComputed("insufficient_data");
    }

    @Test
    void recompute_withNoSamples_isInsufficientData() {
        when(sampleRepo.findWindow("U-1", 30)).thenReturn(List.of());

        BaselineComputation result = service.recompute("U-1");

        assertThat(result.isInsufficientData()).isTrue();
        assertThat(result.getSampleCount()).isZero();
        verify(baselineRepo, never()).save(any());
    }

    @Test
    void recomputeAll_continuesPastFailingUser() {
        Set<String> users = new TreeSet<>(List.of("U-1", "U-2", "U-3"));
        when(sampleRepo.findAllUserIds()).thenReturn(users);
        when(sampleRepo.findWindow("U-1", 30)).thenReturn(TestDataFactory.createSamples("U-1", 10));
        when(sampleRepo.findWindow("U-2", 30)).thenThrow(new IllegalStateException("node unavailable"));
        when(sampleRepo.findWindow("U-3", 30)).thenReturn(TestDataFactory.createSamples("U-3", 10));

        service.recomputeAll();

        verify(baselineRepo, times(2)).save(any(UserBaseline.class));
    }

    @Test
    void recomputeAll_disabled_doesNothing() {
        config.getBaselineRefresh().setEnabled(false);

        service.recomputeAll();

        verifyNoInteractions(sampleRepo, baselineRepo);
    }

    @Test
    void hasValidBaseline_reflectsStoredRecord() {
        when(baselineRepo.findByUserId("U-1"))
                .thenReturn(TestDataFactory.createBaseline("U-1", MetricType.STEPS, 6000, 1000));
        when(baselineRepo.findByUserId("U-2")).thenReturn(null);
        when(baselineRepo.findByUserId("U-3"))
                .thenReturn(TestDataFactory.baselineBuilder("U-3").sampleCount(3).build());

        assertThat(service.hasValidBaseline("U-1")).isTrue();
        assertThat(service.hasValidBaseline("U-2")).isFalse();
        assertThat(service.hasValidBaseline("U-3")).isFalse();
    }
}
