package com.shoplens.backend.model.dto;

import com.shoplens.backend.model.enums.StageName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Success statistics for one pipeline stage over a time window
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StageSuccessRateDTO {
    private StageName stage;
    private Long totalCount;
    private Long successCount;
    private Double avgDurationMs;

    public long getFailureCount() {
        return safe(totalCount) - safe(successCount);
    }

    public double getSuccessRate() {
        long total = safe(totalCount);
        return total > 0 ? (double) safe(successCount) / total * 100 : 0.0;
    }

    private static long safe(Long value) {
        return value == null ? 0L : value;
    }
}
