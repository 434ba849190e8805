package com.shoplens.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Aggregate state of a batch, derived from its jobs on every read.
 */
public enum BatchStatus {
    PENDING,
    PROCESSING,
    COMPLETED;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
