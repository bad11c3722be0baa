package com.backend.artscan.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchTier {
    VERIFIED("verified"),
    COMMUNITY("community"),
    AI_GENERATED("ai_generated");

    private final String value;

    MatchTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
