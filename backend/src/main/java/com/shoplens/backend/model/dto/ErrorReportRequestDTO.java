package com.shoplens.backend.model.dto;

import com.shoplens.backend.model.enums.IssueType;
import com.shoplens.backend.model.enums.Severity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for user-submitted field discrepancy reports
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorReportRequestDTO {

    @Size(max = 36, message = "analysisId must be at most 36 characters")
    private String analysisId;

    @Size(max = 2048, message = "sourceRef must be at most 2048 characters")
    private String sourceRef;

    @NotBlank(message = "fieldName must not be blank")
    @Size(max = 120, message = "fieldName must be at most 120 characters")
    private String fieldName;

    @NotNull(message = "issueType is required")
    private IssueType issueType;

    @NotNull(message = "severity is required")
    private Severity severity;

    @Size(max = 4000, message = "description must be at most 4000 characters")
    private String description;

    @Size(max = 4000, message = "crawlerValue must be at most 4000 characters")
    private String crawlerValue;

    @Size(max = 4000, message = "reportValue must be at most 4000 characters")
    private String reportValue;
}
