package com.shoplens.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromName(String name) {
        if (name == null) return null;
        return Severity.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
