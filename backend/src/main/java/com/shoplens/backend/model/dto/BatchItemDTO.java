package com.shoplens.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.model.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchItemDTO {
    private String sourceRef;
    private String jobId;
    private JobKind kind;
    private JobStatus status;
    private Integer overallScore;
    private String error;
}
