package com.shoplens.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Review state of a user error report. Only the external review workflow
 * moves a report past PENDING.
 */
public enum ReportStatus {
    PENDING,
    REVIEWED,
    RESOLVED;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReportStatus fromName(String name) {
        if (name == null || name.isBlank()) return null;
        return ReportStatus.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
