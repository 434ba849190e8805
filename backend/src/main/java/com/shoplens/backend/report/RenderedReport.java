package com.shoplens.backend.report;

import com.shoplens.backend.model.enums.ReportFormat;
import lombok.Value;

@Value
public class RenderedReport {
    String filename;
    ReportFormat format;
    byte[] content;
}
