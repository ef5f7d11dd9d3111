package com.health.anomaly.controller;

import com.health.anomaly.model.AcknowledgementResult;
import com.health.anomaly.model.Anomaly;
import com.health.anomaly.model.DetectionOutcome;
import com.health.anomaly.model.MetricSample;
import com.health.anomaly.service.AcknowledgementTracker;
import com.health.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Run detection on a daily sample and manage detected anomalies")
public class AnomalyController {

    private final AnomalyDetectionService detectionService;
    private final AcknowledgementTracker acknowledgementTracker;

    public AnomalyController(AnomalyDetectionService detectionService,
                             AcknowledgementTracker acknowledgementTracker) {
        this.detectionService = detectionService;
        this.acknowledgementTracker = acknowledgementTracker;
    }

    @Operation(summary = "Detect anomalies for a sample",
            description = "Compares the sample against the user's baseline. Uses the ML signal when one is " +
                    "deployed and confident, otherwise the 2-standard-deviation threshold rule. " +
                    "Without a valid baseline the result is empty with fallbackReason no_baseline.")
    @ApiResponse(responseCode = "200", description = "Detection outcome",
            content = @Content(schema = @Schema(implementation = DetectionOutcome.class)))
    @ApiResponse(responseCode = "400", description = "Sample failed validation")
    @PostMapping("/detect")
    public ResponseEntity<?> detect(@RequestBody MetricSample sample) {
        try {
            DetectionOutcome outcome = detectionService.detect(sample);
            return ResponseEntity.ok(outcome);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Anomalies for a day",
            description = "Returns the user's anomalies for the given date (default: today, UTC).")
    @GetMapping("/user/{userId}")
    public ResponseEntity<List<Anomaly>> getForDate(
            @Parameter(description = "User ID", example = "USER-001") @PathVariable String userId,
            @Parameter(description = "ISO date", example = "2026-10-17")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate day = date != null ? date : LocalDate.now(ZoneOffset.UTC);
        return ResponseEntity.ok(acknowledgementTracker.findForDate(userId, day));
    }

    @Operation(summary = "Open anomalies",
            description = "Returns anomalies the user has not acknowledged yet, newest first.")
    @GetMapping("/user/{userId}/unacknowledged")
    public ResponseEntity<List<Anomaly>> getUnacknowledged(
            @Parameter(description = "User ID", example = "USER-001") @PathVariable String userId) {
        return ResponseEntity.ok(acknowledgementTracker.findUnacknowledged(userId));
    }

    @Operation(summary = "Recent anomalies",
            description = "Returns the user's most recent anomalies, newest first.")
    @GetMapping("/user/{userId}/recent")
    public ResponseEntity<?> getRecent(
            @Parameter(description = "User ID", example = "USER-001") @PathVariable String userId,
            @RequestParam(defaultValue = "10") int limit) {
        try {
            return ResponseEntity.ok(acknowledgementTracker.findRecent(userId, limit));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Acknowledge an anomaly",
            description = "Marks the anomaly as seen. Acknowledging twice is harmless; unknown ids return 404.")
    @PostMapping("/{anomalyId}/acknowledge")
    public ResponseEntity<?> acknowledge(@PathVariable String anomalyId) {
        AcknowledgementResult result = acknowledgementTracker.acknowledge(anomalyId);
        if (result == AcknowledgementResult.NOT_FOUND) {
            return ResponseEntity.notFound().build();
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("anomalyId", anomalyId);
        response.put("result", result.name());
        response.put("anomaly", acknowledgementTracker.findById(anomalyId));
        return ResponseEntity.ok(response);
    }
}
