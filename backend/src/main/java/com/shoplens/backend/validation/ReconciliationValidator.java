package com.shoplens.backend.validation;

import com.shoplens.backend.config.AnalysisProperties;
import com.shoplens.backend.crawling.HarvestedData;
import com.shoplens.backend.job.output.AnalysisOutput;
import com.shoplens.backend.job.output.ChecklistItem;
import com.shoplens.backend.job.output.ChecklistOutput;
import com.shoplens.backend.job.output.ValidationOutput;
import com.shoplens.backend.model.enums.JobKind;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Compares harvested fields against the analysis result, writes the
 * harvested value back over any drifted result field and reports
 * auto-checked checklist items whose backing field was never harvested.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReconciliationValidator {

    private final AnalysisProperties analysisProperties;
    private final Clock clock;

    public ValidationOutput validate(JobKind kind,
                                     HarvestedData harvested,
                                     AnalysisOutput result,
                                     ChecklistOutput checklist) {
        List<FieldMismatch> mismatches = new ArrayList<>();
        Set<String> correctedFields = new LinkedHashSet<>();
        Map<String, Object> corrections = new LinkedHashMap<>();
        int compared = 0;

        for (FieldCorrespondence mapping : FieldCorrespondence.forKind(kind)) {
            // Nothing to hold the result against when the page lacked the field
            if (!harvested.hasValue(mapping.getHarvestedField())) {
                continue;
            }
            compared++;

            Object crawlerValue = harvested.get(mapping.getHarvestedField());
            Object reportValue = result.get(mapping.getResultField());
            if (ValueNormalizer.sameValue(crawlerValue, reportValue, mapping.getType())) {
                continue;
            }

            mismatches.add(new FieldMismatch(mapping.getHarvestedField(), crawlerValue, reportValue));
            corrections.put(mapping.getResultField(), crawlerValue);
            correctedFields.add(mapping.getHarvestedField());
            log.debug("Field {} drifted: crawler={}, report={}", mapping.getHarvestedField(), crawlerValue, reportValue);
        }

        List<MissingItem> missingItems = new ArrayList<>();
        if (checklist != null) {
            for (ChecklistItem item : checklist.getItems()) {
                if (item.isAutoChecked()
                        && item.getBackingField() != null
                        && !harvested.hasValue(item.getBackingField())) {
                    missingItems.add(new MissingItem(item.getBackingField(), item.getId()));
                }
            }
        }

        int matched = compared - mismatches.size();
        int score = compared == 0 ? 100 : (int) Math.round(100.0 * matched / compared);
        boolean valid = compared == 0 || score >= analysisProperties.getValidationThreshold();

        ValidationReport report = ValidationReport.builder()
                .validationScore(score)
                .valid(valid)
                .mismatches(mismatches)
                .missingItems(missingItems)
                .correctedFields(correctedFields)
                .comparedFieldCount(compared)
                .validatedAt(LocalDateTime.now(clock))
                .build();

        log.info("Reconciled {} ({}): score={}, mismatches={}, missingItems={}",
                harvested.getSourceRef(), kind.getKey(), score, mismatches.size(), missingItems.size());

        AnalysisOutput corrected = corrections.isEmpty() ? result : result.withFields(corrections);
        return new ValidationOutput(report, corrected);
    }
}
