package com.backend.artscan.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal outcome of a scan request.
 */
public enum ScanStatus {
    MATCH_FOUND("match_found"),
    VERIFIED_RESULT("verified_result"),
    COMMUNITY_RESULT("community_result"),
    AI_ANALYSIS("ai_analysis"),
    NOT_ART("not_art");

    private final String value;

    ScanStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ScanStatus forTier(MatchTier tier, boolean legacy) {
        if (legacy) {
            return MATCH_FOUND;
        }
        return tier == MatchTier.VERIFIED ? VERIFIED_RESULT : COMMUNITY_RESULT;
    }
}
