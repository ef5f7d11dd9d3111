package com.health.anomaly.controller;

import com.health.anomaly.model.BaselineComputation;
import com.health.anomaly.model.MetricType;
import com.health.anomaly.model.UserBaseline;
import com.health.anomaly.service.BaselineService;
import com.health.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BaselineController.class)
class BaselineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BaselineService baselineService;

    @Test
    void getBaseline_found() throws Exception {
        UserBaseline baseline = TestDataFactory.createBaseline("U-1", MetricType.STEPS, 6000, 1000);
        when(baselineService.getBaseline("U-1")).thenReturn(baseline);

        mockMvc.perform(get("/api/v1/baselines/U-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("U-1"))
                .andExpect(jsonPath("$.perMetricMean.STEPS").value(6000.0))
                .andExpect(jsonPath("$.perMetricStdDev.STEPS").value(1000.0))
                .andExpect(jsonPath("$.sampleCount").value(30))
                .andExpect(jsonPath("$.valid").value(true));
    }

    @Test
    void getBaseline_notFound() throws Exception {
        when(baselineService.getBaseline("NOBODY")).thenReturn(null);

        mockMvc.perform(get("/api/v1/baselines/NOBODY"))
                .andExpect(status().isNotFound());
    }

    @Test
    void recompute_computed() throws Exception {
        UserBaseline baseline = TestDataFactory.createBaseline("U-1", MetricType.SLEEP, 420, 30);
        when(baselineService.recompute("U-1")).thenReturn(BaselineComputation.computed(baseline));

        mockMvc.perform(post("/api/v1/baselines/U-1/recompute"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.insufficientData").value(false))
                .andExpect(jsonPath("$.sampleCount").value(30))
                .andExpect(jsonPath("$.baseline.perMetricMean.SLEEP").value(420.0));
    }

    @Test
    void recompute_insufficientData() throws Exception {
        when(baselineService.recompute("U-1")).thenReturn(BaselineComputation.insufficient("U-1", 5));

        mockMvc.perform(post("/api/v1/baselines/U-1/recompute"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.insufficientData").value(true))
                .andExpect(jsonPath("$.sampleCount").value(5))
                .andExpect(jsonPath("$.baseline").doesNotExist());
    }
}
