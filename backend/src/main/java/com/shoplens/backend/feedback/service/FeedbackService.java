package com.shoplens.backend.feedback.service;

import com.shoplens.backend.config.FeedbackProperties;
import com.shoplens.backend.feedback.ErrorReportNotFoundException;
import com.shoplens.backend.feedback.entity.ErrorReport;
import com.shoplens.backend.feedback.repository.ErrorReportRepository;
import com.shoplens.backend.model.dto.ErrorReportRequestDTO;
import com.shoplens.backend.model.dto.FieldPriorityStat;
import com.shoplens.backend.model.enums.ReportStatus;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Collects user error reports and ranks fields by how often they are
 * reported. Rankings are computed from the stored reports on every call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackService {

    private final ErrorReportRepository errorReportRepository;
    private final FeedbackProperties feedbackProperties;
    private final FeedbackDiagnostics diagnostics;
    private final Clock clock;

    @Transactional
    public Long submit(ErrorReportRequestDTO request) {
        ErrorReport report = ErrorReport.builder()
                .analysisId(blankToNull(request.getAnalysisId()))
                .sourceRef(blankToNull(request.getSourceRef()))
                .fieldName(request.getFieldName().trim())
                .issueType(request.getIssueType())
                .severity(request.getSeverity())
                .description(request.getDescription())
                .crawlerValue(request.getCrawlerValue())
                .reportValue(request.getReportValue())
                .status(ReportStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();

        ErrorReport saved = errorReportRepository.save(report);
        log.info("Stored error report {} for field '{}' ({}, {})",
                saved.getId(), saved.getFieldName(), saved.getIssueType().toJson(), saved.getSeverity().toJson());

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("errorReportId", saved.getId());
        event.put("fieldName", saved.getFieldName());
        event.put("issueType", saved.getIssueType().toJson());
        event.put("severity", saved.getSeverity().toJson());
        diagnostics.record("error_report_submitted", event);

        return saved.getId();
    }

    /**
     * Reports newest first, optionally filtered by field and review status.
     * The limit is clamped to {@code 1..feedback.max-query-limit}.
     */
    @Transactional(readOnly = true)
    public List<ErrorReport> query(String fieldName, ReportStatus status, Integer limit) {
        int size = clampLimit(limit);
        List<ErrorReport> reports = errorReportRepository.search(blankToNull(fieldName), status, PageRequest.of(0, size));

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("fieldName", fieldName);
        event.put("status", status == null ? null : status.toJson());
        event.put("limit", size);
        event.put("returned", reports.size());
        diagnostics.record("error_reports_queried", event);

        return reports;
    }

    /**
     * Field names ranked by report count, then most recent report, then name.
     */
    @Transactional(readOnly = true)
    public List<String> priorityFields(Integer topK) {
        return priorityStats(topK).stream()
                .map(FieldPriorityStat::getFieldName)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<FieldPriorityStat> priorityStats(Integer topK) {
        int k = topK == null ? feedbackProperties.getDefaultTopK() : topK;
        if (k <= 0) {
            return List.of();
        }
        return errorReportRepository.findFieldPriorityStats(PageRequest.of(0, k));
    }

    /**
     * Whether a field is among the top reported fields and deserves extra
     * crawling effort.
     */
    @Transactional(readOnly = true)
    public boolean shouldPrioritize(String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return false;
        }
        return priorityFields(feedbackProperties.getDefaultTopK()).contains(fieldName.trim());
    }

    @Transactional
    public ErrorReport updateStatus(Long id, ReportStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        ErrorReport report = errorReportRepository.findById(id)
                .orElseThrow(() -> new ErrorReportNotFoundException(id));

        ReportStatus previous = report.getStatus();
        report.setStatus(status);
        report.setUpdatedAt(LocalDateTime.now(clock));
        ErrorReport saved = errorReportRepository.save(report);

        log.info("Error report {} moved from {} to {}", id, previous.toJson(), status.toJson());
        return saved;
    }

    private int clampLimit(Integer limit) {
        int requested = limit == null ? feedbackProperties.getDefaultQueryLimit() : limit;
        return Math.max(1, Math.min(requested, feedbackProperties.getMaxQueryLimit()));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
