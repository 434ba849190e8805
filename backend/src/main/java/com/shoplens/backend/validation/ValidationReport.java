package com.shoplens.backend.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time consistency report between harvested data and the analysis
 * result. Built once per job and never recomputed.
 */
@Value
@Builder
public class ValidationReport {
    int validationScore;
    @JsonProperty("isValid")
    boolean valid;
    List<FieldMismatch> mismatches;
    List<MissingItem> missingItems;
    Set<String> correctedFields;
    int comparedFieldCount;
    LocalDateTime validatedAt;

    public List<FieldMismatch> getMismatches() {
        return mismatches == null ? List.of() : List.copyOf(mismatches);
    }

    public List<MissingItem> getMissingItems() {
        return missingItems == null ? List.of() : List.copyOf(missingItems);
    }

    public Set<String> getCorrectedFields() {
        return correctedFields == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(correctedFields));
    }
}
