package com.shoplens.backend.job;

import com.shoplens.backend.config.AnalysisProperties;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.model.enums.StageName;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides the ordered stage sequence for a job kind.
 */
@Component
@RequiredArgsConstructor
public class StagePlanner {

    private static final List<StageName> FULL_PLAN = List.of(
            StageName.QUEUED,
            StageName.CRAWLING,
            StageName.ANALYZING,
            StageName.EVALUATING_CHECKLIST,
            StageName.VALIDATING,
            StageName.COMPLETED
    );

    private static final List<StageName> WITHOUT_VALIDATION = List.of(
            StageName.QUEUED,
            StageName.CRAWLING,
            StageName.ANALYZING,
            StageName.EVALUATING_CHECKLIST,
            StageName.COMPLETED
    );

    private final AnalysisProperties analysisProperties;

    public List<StageName> planFor(JobKind kind) {
        if (kind == JobKind.COLLECTION && !analysisProperties.isValidateCollections()) {
            return WITHOUT_VALIDATION;
        }
        return FULL_PLAN;
    }
}
