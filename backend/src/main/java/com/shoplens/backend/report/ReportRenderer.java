package com.shoplens.backend.report;

import com.shoplens.backend.job.AnalysisJob;
import com.shoplens.backend.model.enums.ReportFormat;

/**
 * Turns a completed job into a downloadable document.
 */
public interface ReportRenderer {

    byte[] render(AnalysisJob job, ReportFormat format);
}
