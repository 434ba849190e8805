package com.shoplens.backend.feedback.controller;

import com.shoplens.backend.feedback.entity.ErrorReport;
import com.shoplens.backend.feedback.service.FeedbackService;
import com.shoplens.backend.model.dto.ErrorReportRequestDTO;
import com.shoplens.backend.model.dto.ErrorReportStatusUpdateDTO;
import com.shoplens.backend.model.dto.FieldPriorityStat;
import com.shoplens.backend.model.enums.ReportStatus;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for user error reports and crawl-priority feedback
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/error-reports")
@RequiredArgsConstructor
public class ErrorReportController {

    private final FeedbackService feedbackService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody ErrorReportRequestDTO request) {
        Long id = feedbackService.submit(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("errorReportId", id));
    }

    @GetMapping
    public ResponseEntity<List<ErrorReport>> query(
            @RequestParam(required = false) String fieldName,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer limit) {

        return ResponseEntity.ok(feedbackService.query(fieldName, ReportStatus.fromName(status), limit));
    }

    /**
     * Get the fields users report most, with their counts
     */
    @GetMapping("/priority-fields")
    public ResponseEntity<Map<String, Object>> priorityFields(@RequestParam(required = false) Integer topK) {
        List<FieldPriorityStat> stats = feedbackService.priorityStats(topK);
        List<String> fields = stats.stream().map(FieldPriorityStat::getFieldName).toList();
        return ResponseEntity.ok(Map.of("fields", fields, "stats", stats));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<ErrorReport> updateStatus(
            @PathVariable Long id,
            @Valid @RequestBody ErrorReportStatusUpdateDTO request) {

        log.info("Review status update requested for error report {}: {}", id, request.getStatus());
        return ResponseEntity.ok(feedbackService.updateStatus(id, ReportStatus.fromName(request.getStatus())));
    }
}
