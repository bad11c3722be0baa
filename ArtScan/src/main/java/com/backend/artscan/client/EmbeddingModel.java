package com.backend.artscan.client;

/**
 * Image embedding capability. Implementations throw {@link TransientServiceException} for failures worth one
 * retry and any other runtime exception for permanent ones.
 */
public interface EmbeddingModel {

    float[] embed(byte[] image, String contentType);
}
