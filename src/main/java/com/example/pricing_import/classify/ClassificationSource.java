package com.example.pricing_import.classify;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ClassificationSource {
    AI_HINT("ai_hint"),
    KEYWORD_RULE("keyword_rule"),
    UNCLASSIFIED("unclassified");

    private final String code;

    ClassificationSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
