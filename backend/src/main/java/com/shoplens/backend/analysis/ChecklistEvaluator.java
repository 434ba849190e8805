package com.shoplens.backend.analysis;

import com.shoplens.backend.crawling.HarvestedData;
import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.job.output.ChecklistOutput;
import com.shoplens.backend.model.enums.JobKind;

public interface ChecklistEvaluator {

    ChecklistOutput evaluate(JobKind kind, HarvestedData data, AnalysisOutput analysis);
}
