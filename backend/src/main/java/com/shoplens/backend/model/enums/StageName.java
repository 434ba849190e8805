package com.shoplens.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum StageName {
    QUEUED("queued"),
    CRAWLING("crawling"),
    ANALYZING("analyzing"),
    EVALUATING_CHECKLIST("evaluating-checklist"),
    VALIDATING("validating"),
    COMPLETED("completed");

    private final String key;

    StageName(String key) {
        this.key = key;
    }

    @JsonValue
    public String toJson() {
        return key;
    }
}
