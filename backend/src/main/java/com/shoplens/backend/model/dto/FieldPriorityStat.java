package com.shoplens.backend.model.dto;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How often users reported a field, derived from the error reports on
 * every read.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldPriorityStat {
    private String fieldName;
    private Long reportCount;
    private LocalDateTime lastReportedAt;
}
