package com.shoplens.backend.history;

import com.shoplens.backend.model.dto.JobStatusDTO;
import com.shoplens.backend.model.dto.ScoreTrendPointDTO;
import com.shoplens.backend.model.enums.JobKind;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/history")
@RequiredArgsConstructor
public class HistoryController {

    private final AnalysisHistoryService historyService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(
            @RequestParam(required = false) String sourceRef,
            @RequestParam(required = false) String kind,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {

        JobKind jobKind = null;
        if (kind != null && !kind.isBlank()) {
            jobKind = JobKind.fromName(kind);
            if (jobKind == null) {
                throw new IllegalArgumentException("Unknown kind: " + kind);
            }
        }
        return ResponseEntity.ok(Map.of("history", historyService.list(sourceRef, jobKind, limit, offset)));
    }

    /**
     * Daily score trend of one source; the URL travels as a query parameter
     */
    @GetMapping("/trend")
    public ResponseEntity<Map<String, Object>> trend(
            @RequestParam String sourceRef,
            @RequestParam(defaultValue = "30") int days) {

        List<ScoreTrendPointDTO> trend = historyService.scoreTrend(sourceRef, days);
        return ResponseEntity.ok(Map.of("sourceRef", sourceRef.trim(), "days", days, "trend", trend));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<JobStatusDTO> get(@PathVariable String jobId) {
        return ResponseEntity.ok(historyService.get(jobId));
    }
}
