package com.backend.artscan.service;

import com.backend.artscan.client.EmbeddingModel;
import com.backend.artscan.client.TransientServiceException;
import com.backend.artscan.config.ArtScanProperties;
import com.backend.artscan.exception.EmbeddingUnavailableException;
import com.backend.artscan.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Wraps the embedding model: one retry on transient transport failures, then strict validation of the
 * returned vector. Output is always unit length and exactly {@code embedding.dimension} long.
 */
@Slf4j
@Service
public class EmbeddingGateway {

    private final EmbeddingModel embeddingModel;
    private final int dimension;

    public EmbeddingGateway(EmbeddingModel embeddingModel, ArtScanProperties properties) {
        this.embeddingModel = embeddingModel;
        this.dimension = properties.getEmbedding().getDimension();
    }

    public float[] embed(byte[] image, String contentType) {
        float[] raw;
        try {
            raw = call(image, contentType);
        } catch (TransientServiceException first) {
            log.warn("Embedding call failed ({}), retrying once", first.getMessage());
            try {
                raw = call(image, contentType);
            } catch (TransientServiceException second) {
                throw new EmbeddingUnavailableException("Embedding service unavailable: " + second.getMessage(), second);
            }
        }
        return validate(raw);
    }

    public int dimension() {
        return dimension;
    }

    private float[] call(byte[] image, String contentType) {
        try {
            return embeddingModel.embed(image, contentType);
        } catch (TransientServiceException | EmbeddingUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException("Embedding call failed: " + e.getMessage(), e);
        }
    }

    private float[] validate(float[] raw) {
        if (raw == null) {
            throw new EmbeddingUnavailableException("Embedding model returned nothing");
        }
        if (raw.length != dimension) {
            throw new EmbeddingUnavailableException(
                    "Expected embedding dimension " + dimension + ", got " + raw.length);
        }
        if (!VectorMath.allFinite(raw)) {
            throw new EmbeddingUnavailableException("Embedding contains non-finite components");
        }
        if (VectorMath.l2Norm(raw) == 0) {
            throw new EmbeddingUnavailableException("Embedding is the zero vector");
        }
        return VectorMath.normalize(raw);
    }
}
