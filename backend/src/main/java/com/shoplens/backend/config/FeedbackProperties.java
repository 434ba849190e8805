package com.shoplens.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "feedback")
public class FeedbackProperties {

    private int defaultQueryLimit = 50;
    private int maxQueryLimit = 200;
    private int defaultTopK = 10;

    // JSON-lines diagnostics side channel, off unless enabled
    private boolean diagnosticsEnabled = false;
    private String diagnosticsPath = "logs/feedback-diagnostics.jsonl";
}
