package com.backend.artscan.dto;

import com.backend.artscan.model.ArtworkAnalysis;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisDto {
    @JsonProperty("is_artwork")
    private boolean artwork;
    private String label;
    private String artist;
    private String description;
    private Map<String, Object> details;
    private Double confidence;

    public static AnalysisDto fromModel(ArtworkAnalysis analysis) {
        if (analysis == null)
            return null;
        return AnalysisDto.builder()
                .artwork(analysis.isArtwork())
                .label(analysis.getLabel())
                .artist(analysis.getArtist())
                .description(analysis.getDescription())
                .details(analysis.getDetails())
                .confidence(analysis.getConfidence())
                .build();
    }
}
