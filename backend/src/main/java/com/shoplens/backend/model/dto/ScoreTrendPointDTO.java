package com.shoplens.backend.model.dto;

import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Overall scores of one source on one day
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreTrendPointDTO {
    private LocalDate date;
    private double avgScore;
    private int maxScore;
    private int minScore;
    private long count;
}
