package com.shoplens.backend.model.dto;

import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.model.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeResponseDTO {
    private String jobId;
    private JobStatus status;
    private JobKind kindDetected;
}
