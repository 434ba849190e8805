package com.shoplens.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shoplens.backend.model.enums.BatchStatus;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated progress of a batch. Rejected URLs count as failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchStatusDTO {
    private String batchId;
    private String name;
    private BatchStatus status;
    private int totalCount;
    private int pendingCount;
    private int completedCount;
    private int failedCount;
    // Mean overall score of completed jobs, absent until one completes
    private Double averageScore;
    private LocalDateTime createdAt;
}
