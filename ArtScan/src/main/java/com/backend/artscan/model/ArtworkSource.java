package com.backend.artscan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ArtworkSource {
    MUSEUM_API("museum_api"),
    AI_GENERATED("ai_generated"),
    ADMIN("admin"),
    COMMUNITY("community");

    private final String value;

    ArtworkSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Only museum feeds and administrators may vouch for an artwork. */
    public boolean isTrusted() {
        return this == MUSEUM_API || this == ADMIN;
    }

    @JsonCreator
    public static ArtworkSource fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown artwork source: " + value));
    }
}
