package com.backend.artscan.service;

import com.backend.artscan.client.ImageStore;
import com.backend.artscan.exception.ArtworkNotFoundException;
import com.backend.artscan.exception.MuseumNotFoundException;
import com.backend.artscan.model.Artwork;
import com.backend.artscan.model.ArtworkSource;
import com.backend.artscan.model.Museum;
import com.backend.artscan.repository.ArtworkRepository;
import com.backend.artscan.repository.MuseumRepository;
import com.backend.artscan.util.DescriptionJson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Administrator-side catalog maintenance: museums and curated, verified artworks.
 */
@Slf4j
@Service
public class CatalogAdminService {

    private final MuseumRepository museumRepository;
    private final ArtworkRepository artworkRepository;
    private final EmbeddingGateway embeddingGateway;
    private final ImageValidator imageValidator;
    private final ImageStore imageStore;
    private final DescriptionJson descriptionJson;

    public CatalogAdminService(MuseumRepository museumRepository,
                               ArtworkRepository artworkRepository,
                               EmbeddingGateway embeddingGateway,
                               ImageValidator imageValidator,
                               ImageStore imageStore,
                               DescriptionJson descriptionJson) {
        this.museumRepository = museumRepository;
        this.artworkRepository = artworkRepository;
        this.embeddingGateway = embeddingGateway;
        this.imageValidator = imageValidator;
        this.imageStore = imageStore;
        this.descriptionJson = descriptionJson;
    }

    public Museum createMuseum(Museum museum) {
        museum.setId(null);
        Museum saved = museumRepository.save(museum);
        log.info("Created museum {} '{}' with a {} m geofence", saved.getId(), saved.getName(),
                saved.getGeofenceRadiusMeters());
        return saved;
    }

    @Transactional
    public Museum updateMuseum(Long museumId, Museum changes) {
        Museum existing = getMuseum(museumId);
        if (changes.getName() != null && !changes.getName().isBlank()) {
            existing.setName(changes.getName());
        }
        existing.setLatitude(changes.getLatitude());
        existing.setLongitude(changes.getLongitude());
        existing.setGeofenceRadiusMeters(changes.getGeofenceRadiusMeters());
        return museumRepository.save(existing);
    }

    public Museum getMuseum(Long museumId) {
        return museumRepository.findById(museumId).orElseThrow(() -> new MuseumNotFoundException(museumId));
    }

    public List<Museum> listMuseums() {
        return museumRepository.findAll();
    }

    public Artwork getArtwork(Long artworkId) {
        return artworkRepository.findById(artworkId).orElseThrow(() -> new ArtworkNotFoundException(artworkId));
    }

    /**
     * Adds a curated artwork. The image is embedded like a scan so later scans of the piece match it.
     */
    public Artwork createVerifiedArtwork(byte[] image, String contentType, String filename,
                                         String title, String artist, Map<String, Object> description,
                                         Long museumId, ArtworkSource source) {
        ArtworkSource effectiveSource = source == null ? ArtworkSource.ADMIN : source;
        if (!effectiveSource.isTrusted()) {
            throw new IllegalArgumentException("Curated artworks must come from museum_api or admin, not "
                    + effectiveSource.getValue());
        }
        imageValidator.validate(image, contentType);
        Museum museum = museumId == null ? null : getMuseum(museumId);
        float[] embedding = embeddingGateway.embed(image, contentType);

        String imageUrl;
        try {
            imageUrl = imageStore.store(image, contentType, filename);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot store artwork image", e);
        }

        Artwork artwork = Artwork.builder()
                .museum(museum)
                .title(title)
                .artist(artist)
                .descriptionJson(descriptionJson.write(description))
                .imageUrl(imageUrl)
                .embedding(embedding)
                .verified(true)
                .source(effectiveSource)
                .confidenceScore(1.0)
                .build();
        Artwork saved = artworkRepository.save(artwork);
        log.info("Added verified artwork {} '{}' by {}", saved.getId(), saved.getTitle(), saved.getArtist());
        return saved;
    }
}
