package com.shoplens.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum IssueType {
    MISMATCH,
    MISSING,
    INCORRECT_FORMAT,
    OTHER;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @JsonCreator
    public static IssueType fromName(String name) {
        if (name == null) return null;
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (IssueType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown issue type: " + name);
    }
}
