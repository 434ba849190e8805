package com.shoplens.backend.job.output;

import com.shoplens.backend.model.enums.StageName;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Score-bearing analysis result. {@code resultFields} holds the values the
 * analysis re-derived from the page, keyed by dotted result paths such as
 * {@code product_analysis.price_analysis.sale_price}.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisOutput implements StageOutput {
    int overallScore;
    Map<String, Integer> sectionScores;
    Map<String, Object> resultFields;

    @Override
    public StageName getStage() {
        return StageName.ANALYZING;
    }

    public Map<String, Integer> getSectionScores() {
        return sectionScores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sectionScores));
    }

    public Map<String, Object> getResultFields() {
        return resultFields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(resultFields));
    }

    public Object get(String resultField) {
        return resultFields == null ? null : resultFields.get(resultField);
    }

    /**
     * Copy of this result with the given fields overwritten.
     */
    public AnalysisOutput withFields(Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(getResultFields());
        merged.putAll(overrides);
        return toBuilder().resultFields(merged).build();
    }
}
