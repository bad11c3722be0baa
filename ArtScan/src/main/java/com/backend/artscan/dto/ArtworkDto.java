package com.backend.artscan.dto;

import com.backend.artscan.model.Artwork;
import com.backend.artscan.model.ArtworkSource;
import com.backend.artscan.model.MatchTier;
import com.backend.artscan.util.DescriptionJson;
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
public class ArtworkDto {
    private Long id;
    private Long museumId;
    private String title;
    private String artist;
    private Map<String, Object> description;
    private String imageUrl;
    @JsonProperty("is_verified")
    private boolean verified;
    private ArtworkSource source;
    private MatchTier tier;
    private Double confidenceScore;
    /** 1 - cosine distance to the scanned image. */
    private Double similarity;

    public static ArtworkDto fromModel(Artwork artwork, Double distance, DescriptionJson descriptionJson) {
        if (artwork == null)
            return null;
        return ArtworkDto.builder()
                .id(artwork.getId())
                .museumId(artwork.getMuseum() != null ? artwork.getMuseum().getId() : null)
                .title(artwork.getTitle())
                .artist(artwork.getArtist())
                .description(descriptionJson.read(artwork.getDescriptionJson()))
                .imageUrl(artwork.getImageUrl())
                .verified(artwork.isVerified())
                .source(artwork.getSource())
                .tier(artwork.tier())
                .confidenceScore(artwork.getConfidenceScore())
                .similarity(distance != null ? 1.0 - distance : null)
                .build();
    }
}
