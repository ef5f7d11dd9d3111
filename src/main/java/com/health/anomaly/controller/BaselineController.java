package com.health.anomaly.controller;

import com.health.anomaly.model.BaselineComputation;
import com.health.anomaly.model.UserBaseline;
import com.health.anomaly.service.BaselineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/baselines")
@Tag(name = "Baselines", description = "Per-user statistical baselines (mean and standard deviation per metric)")
public class BaselineController {

    private final BaselineService baselineService;

    public BaselineController(BaselineService baselineService) {
        this.baselineService = baselineService;
    }

    @Operation(summary = "Get a user's baseline",
            description = "Returns the stored baseline, or 404 when none has been computed yet.")
    @GetMapping("/{userId}")
    public ResponseEntity<UserBaseline> getBaseline(
            @Parameter(description = "User ID", example = "USER-001") @PathVariable String userId) {
        UserBaseline baseline = baselineService.getBaseline(userId);
        if (baseline == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(baseline);
    }

    @Operation(summary = "Recompute a user's baseline",
            description = "Recomputes from the rolling window. With fewer than 7 samples nothing is stored " +
                    "and insufficientData is true.")
    @PostMapping("/{userId}/recompute")
    public ResponseEntity<Map<String, Object>> recompute(
            @Parameter(description = "User ID", example = "USER-001") @PathVariable String userId) {
        BaselineComputation computation = baselineService.recompute(userId);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("userId", userId);
        response.put("sampleCount", computation.getSampleCount());
        response.put("insufficientData", computation.isInsufficientData());
        computation.asBaseline().ifPresent(b -> response.put("baseline", b));
        return ResponseEntity.ok(response);
    }
}
