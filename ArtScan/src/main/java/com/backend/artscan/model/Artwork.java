package com.backend.artscan.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A catalogued artwork. {@code museum} is null for unaffiliated pieces.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table(name = "artworks", indexes = {
        @Index(name = "idx_artworks_museum_id", columnList = "museum_id"),
        @Index(name = "idx_artworks_is_verified", columnList = "is_verified"),
        @Index(name = "idx_artworks_source", columnList = "source")
})
public class Artwork {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "museum_id")
    private Museum museum;

    @NotBlank
    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "artist")
    private String artist;

    /** JSON object: style, year, era, medium, narrative and so on. */
    @Column(name = "description_json", length = 8000)
    private String descriptionJson;

    @Column(name = "image_url", length = 1024)
    private String imageUrl;

    @NotNull
    @Convert(converter = EmbeddingConverter.class)
    @Column(name = "embedding", nullable = false, length = 8192)
    private float[] embedding;

    @Column(name = "is_verified", nullable = false)
    private boolean verified;

    @NotNull
    @Column(name = "source", nullable = false, length = 50)
    private ArtworkSource source;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @AssertTrue(message = "only museum_api or admin artworks can be verified")
    private boolean isVerificationConsistent() {
        return !verified || (source != null && source.isTrusted());
    }

    public MatchTier tier() {
        return verified ? MatchTier.VERIFIED : MatchTier.COMMUNITY;
    }

    @PrePersist
    void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
