package com.shoplens.backend.model.enums;

import java.util.Locale;
import lombok.Getter;

@Getter
public enum ReportFormat {
    MARKDOWN("text/markdown", "md"),
    JSON("application/json", "json");

    private final String mediaType;
    private final String extension;

    ReportFormat(String mediaType, String extension) {
        this.mediaType = mediaType;
        this.extension = extension;
    }

    public static ReportFormat fromName(String name) {
        if (name == null) return null;
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("MD".equals(normalized)) {
            return MARKDOWN;
        }
        for (ReportFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        return null;
    }
}
