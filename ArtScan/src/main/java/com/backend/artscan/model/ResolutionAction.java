package com.backend.artscan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * What a moderator does with an open issue report.
 */
public enum ResolutionAction {
    DISMISS("dismiss"),
    CORRECT("correct"),
    DELETE_ARTWORK("delete_artwork");

    private final String value;

    ResolutionAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ResolutionAction fromValue(String value) {
        return Arrays.stream(values())
                .filter(a -> a.value.equalsIgnoreCase(value) || a.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown resolution action: " + value));
    }
}
