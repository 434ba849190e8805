package com.shoplens.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shoplens.backend.job.AnalysisJob;
import com.shoplens.backend.job.JobProgress;
import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.model.enums.JobStatus;
import com.shoplens.backend.validation.ValidationReport;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for job status responses. Result and validation only appear once the
 * job has completed, error only once it has failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusDTO {
    private String jobId;
    private String sourceRef;
    private JobKind kind;
    private JobStatus status;
    private JobProgress progress;
    private AnalysisOutput result;
    private ValidationReport validation;
    private String error;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static JobStatusDTO from(AnalysisJob job) {
        boolean completed = job.getStatus() == JobStatus.COMPLETED;
        return JobStatusDTO.builder()
                .jobId(job.getId())
                .sourceRef(job.getSourceRef())
                .kind(job.getKind())
                .status(job.getStatus())
                .progress(job.getProgress())
                .result(completed ? job.getResult() : null)
                .validation(completed ? job.getValidation() : null)
                .error(job.getStatus() == JobStatus.FAILED ? job.getError() : null)
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }
}
