package com.backend.artscan.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CatalogRequest {
    float[] embedding;
    String title;
    String artist;
    Map<String, Object> description;
    Double confidence;
    GeofenceScope scope;
    String imageUrl;
}
