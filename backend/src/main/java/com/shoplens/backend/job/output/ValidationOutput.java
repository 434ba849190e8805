package com.shoplens.backend.job.output;

import com.shoplens.backend.model.enums.StageName;
import com.shoplens.backend.validation.ValidationReport;
import lombok.Value;

/**
 * Reconciliation result: the report plus the analysis result after the
 * harvested values were written back over drifted fields.
 */
@Value
public class ValidationOutput implements StageOutput {
    ValidationReport report;
    AnalysisOutput correctedResult;

    @Override
    public StageName getStage() {
        return StageName.VALIDATING;
    }
}
