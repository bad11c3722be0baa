package com.backend.artscan.client;

import com.backend.artscan.config.ArtScanProperties;
import com.backend.artscan.exception.EmbeddingUnavailableException;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Calls the CLIP embedding service: {@code POST /embed} with a multipart {@code file}, answering
 * {@code {"embedding": [...]}}.
 */
@Component
public class HttpEmbeddingModel implements EmbeddingModel {

    private final WebClient webClient;
    private final Duration timeout;

    public HttpEmbeddingModel(WebClient.Builder webClientBuilder, ArtScanProperties properties) {
        this.webClient = webClientBuilder.baseUrl(properties.getEmbedding().getUrl()).build();
        this.timeout = properties.getEmbedding().getTimeout();
    }

    @Override
    public float[] embed(byte[] image, String contentType) {
        MultipartBodyBuilder bodyBuilder = new MultipartBodyBuilder();
        bodyBuilder.part("file", new ByteArrayResource(image) {
            @Override
            public String getFilename() {
                return "scan";
            }
        }).contentType(contentType != null ? MediaType.parseMediaType(contentType) : MediaType.APPLICATION_OCTET_STREAM);

        Map<?, ?> response;
        try {
            response = webClient.post()
                    .uri("/embed")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(bodyBuilder.build()))
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientRequestException e) {
            throw new TransientServiceException("Embedding service unreachable", e);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().is5xxServerError()) {
                throw new TransientServiceException("Embedding service error " + e.getStatusCode().value(), e);
            }
            throw new EmbeddingUnavailableException("Embedding service rejected the image: " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new TransientServiceException("Embedding service timed out after " + timeout, e);
            }
            throw e;
        }
        return toVector(response);
    }

    private static float[] toVector(Map<?, ?> response) {
        Object raw = response == null ? null : response.get("embedding");
        if (!(raw instanceof List)) {
            throw new EmbeddingUnavailableException("Embedding service returned no embedding");
        }
        List<?> values = (List<?>) raw;
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            Object value = values.get(i);
            if (!(value instanceof Number)) {
                throw new EmbeddingUnavailableException("Embedding component " + i + " is not numeric");
            }
            vector[i] = ((Number) value).floatValue();
        }
        return vector;
    }
}
