package com.shoplens.backend.monitoring.controller;

import com.shoplens.backend.model.enums.StageName;
import com.shoplens.backend.monitoring.entity.StageExecutionLog;
import com.shoplens.backend.monitoring.service.PipelineMonitoringService;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/pipeline")
@RequiredArgsConstructor
public class PipelineMonitoringController {

    private final PipelineMonitoringService monitoringService;

    /**
     * Get per-stage success rates
     */
    @GetMapping("/success-rates")
    public ResponseEntity<Map<String, Object>> getSuccessRates(@RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(monitoringService.getSuccessRates(days));
    }

    /**
     * Get the most recent execution records of one stage
     */
    @GetMapping("/stages/{stage}")
    public ResponseEntity<List<StageExecutionLog>> getStageDetails(
            @PathVariable String stage,
            @RequestParam(defaultValue = "100") int limit) {

        StageName stageName = Arrays.stream(StageName.values())
                .filter(s -> s.getKey().equalsIgnoreCase(stage) || s.name().equalsIgnoreCase(stage))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown pipeline stage: " + stage));

        return ResponseEntity.ok(monitoringService.getStageDetails(stageName, limit));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<List<StageExecutionLog>> getJobHistory(@PathVariable String jobId) {
        return ResponseEntity.ok(monitoringService.getJobHistory(jobId));
    }
}
