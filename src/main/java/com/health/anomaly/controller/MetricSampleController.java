package com.health.anomaly.controller;

import com.health.anomaly.model.MetricSample;
import com.health.anomaly.service.MetricSampleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/samples")
@Tag(name = "Samples", description = "Ingest daily health metric samples and read a user's recent history")
public class MetricSampleController {

    private final MetricSampleService sampleService;

    public MetricSampleController(MetricSampleService sampleService) {
        this.sampleService = sampleService;
    }

    @Operation(summary = "Ingest a daily sample",
            description = "Stores one day of metrics for a user. A sample for a day that already has one " +
                    "replaces it. Triggers a baseline recompute once enough new samples have arrived.")
    @PostMapping
    public ResponseEntity<?> ingest(@RequestBody MetricSample sample) {
        try {
            return ResponseEntity.ok(sampleService.ingest(sample));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Get recent samples",
            description = "Returns the user's most recent samples, oldest first.")
    @GetMapping("/{userId}")
    public ResponseEntity<?> getWindow(
            @Parameter(description = "User ID", example = "USER-001") @PathVariable String userId,
            @Parameter(description = "Number of most recent days") @RequestParam(defaultValue = "30") int days) {
        try {
            List<MetricSample> samples = sampleService.getWindow(userId, days);
            return ResponseEntity.ok(samples);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
