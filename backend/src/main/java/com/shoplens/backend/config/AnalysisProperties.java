package com.shoplens.backend.config;

import com.shoplens.backend.model.enums.StageName;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the analysis pipeline: worker pool sizing, time budget,
 * stage weights and the reconciliation threshold.
 */
@Data
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    private int workerPoolSize = 4;
    private int queueCapacity = 100;
    private Duration jobTimeout = Duration.ofMinutes(3);

    // Minimum validation score for a report to count as valid
    private int validationThreshold = 90;

    // Collections only get a validating stage when this is on
    private boolean validateCollections = true;

    // Hosts accepted at submission; empty means any host
    private List<String> allowedHosts = List.of("qoo10.jp", "qoo10.com");

    // Largest number of URLs accepted by one batch submission
    private int maxBatchSize = 50;

    private int defaultHistoryLimit = 50;
    private int maxHistoryLimit = 200;

    private Map<StageName, Integer> stageWeights = defaultWeights();

    public int weightOf(StageName stage) {
        Integer weight = stageWeights.get(stage);
        if (weight == null) {
            throw new IllegalStateException("No progress weight configured for stage " + stage);
        }
        return weight;
    }

    private static Map<StageName, Integer> defaultWeights() {
        Map<StageName, Integer> weights = new EnumMap<>(StageName.class);
        weights.put(StageName.QUEUED, 0);
        weights.put(StageName.CRAWLING, 30);
        weights.put(StageName.ANALYZING, 55);
        weights.put(StageName.EVALUATING_CHECKLIST, 75);
        weights.put(StageName.VALIDATING, 90);
        weights.put(StageName.COMPLETED, 100);
        return weights;
    }
}
