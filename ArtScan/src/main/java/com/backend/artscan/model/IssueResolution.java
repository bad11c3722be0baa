package com.backend.artscan.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class IssueResolution {
    ResolutionAction action;
    String moderatorId;
    String note;
    /** Corrections; null fields are left unchanged. */
    String title;
    String artist;
    Map<String, Object> description;
}
