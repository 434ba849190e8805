package com.shoplens.backend.job.output;

import com.shoplens.backend.model.enums.StageName;

/**
 * Structured output committed by one pipeline stage. Implementations are
 * {@link CrawlOutput}, {@link AnalysisOutput}, {@link ChecklistOutput} and
 * {@link ValidationOutput}.
 */
public interface StageOutput {

    StageName getStage();
}
