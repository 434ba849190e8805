package com.shoplens.backend.feedback.entity;

import com.shoplens.backend.model.enums.IssueType;
import com.shoplens.backend.model.enums.ReportStatus;
import com.shoplens.backend.model.enums.Severity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A user report that a harvested field and the analysis report disagree,
 * or that a field was missed. Reports are appended and never deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "error_reports", indexes = {
        @Index(name = "idx_error_reports_field", columnList = "fieldName"),
        @Index(name = "idx_error_reports_status", columnList = "status"),
        @Index(name = "idx_error_reports_created_at", columnList = "createdAt")
})
public class ErrorReport {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Back-reference to the analysis job, if the report came from one
    @Column(length = 36)
    private String analysisId;

    @Column(length = 4000)
    private String sourceRef;

    @Column(nullable = false, length = 120)
    private String fieldName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private IssueType issueType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Severity severity;

    @Column(length = 4000)
    private String description;

    @Column(length = 4000)
    private String crawlerValue;

    @Column(length = 4000)
    private String reportValue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private ReportStatus status;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
