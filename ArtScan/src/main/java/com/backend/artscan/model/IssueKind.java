package com.backend.artscan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum IssueKind {
    WRONG_TITLE("wrong_title"),
    WRONG_ARTIST("wrong_artist"),
    NOT_ARTWORK("not_artwork");

    private final String value;

    IssueKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static IssueKind fromValue(String value) {
        return Arrays.stream(values())
                .filter(k -> k.value.equalsIgnoreCase(value) || k.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown issue type: " + value));
    }
}
