package com.shoplens.backend.analysis;

import com.shoplens.backend.crawling.HarvestedData;
import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.model.enums.JobKind;

/**
 * Scores a harvested page and re-derives the fields the report presents.
 */
public interface AnalysisEngine {

    AnalysisOutput analyze(JobKind kind, HarvestedData data);
}
