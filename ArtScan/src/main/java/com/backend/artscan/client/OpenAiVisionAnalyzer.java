package com.backend.artscan.client;

import com.backend.artscan.config.ArtScanProperties;
import com.backend.artscan.exception.AnalysisUnavailableException;
import com.backend.artscan.model.ArtworkAnalysis;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks an OpenAI-compatible chat-completions endpoint to describe the image as an art historian would.
 */
@Component
public class OpenAiVisionAnalyzer implements VisionAnalyzer {

    static final String UNKNOWN_TITLE = "Unknown Artwork";

    private static final String SYSTEM_PROMPT = "You are a friendly art historian. Analyze artworks and provide "
            + "insights about style, era, and medium. Do not make up specific names if you don't know them. "
            + "If the image is not an artwork, politely indicate that.";

    private static final String USER_PROMPT = "Analyze this artwork. Estimate the style, era, and medium. "
            + "Reply with a JSON object with the keys is_artwork (boolean), title, artist, style, era, medium, "
            + "description and confidence (a number between 0 and 1). Use null for a title or artist you do not know.";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ArtScanProperties.Analysis settings;

    public OpenAiVisionAnalyzer(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                ArtScanProperties properties) {
        this.settings = properties.getAnalysis();
        this.webClient = webClientBuilder
                .baseUrl(settings.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey())
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public ArtworkAnalysis analyze(byte[] image, String contentType) {
        String mediaType = contentType != null ? contentType : MediaType.IMAGE_JPEG_VALUE;
        String dataUrl = "data:" + mediaType + ";base64," + Base64.getEncoder().encodeToString(image);

        Map<String, Object> request = Map.of(
                "model", settings.getModel(),
                "max_tokens", settings.getMaxTokens(),
                "response_format", Map.of("type", "json_object"),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", List.of(
                                Map.of("type", "text", "text", USER_PROMPT),
                                Map.of("type", "image_url", "image_url", Map.of("url", dataUrl))))));

        JsonNode response;
        try {
            response = webClient.post()
                    .uri("/v1/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(settings.getTimeout())
                    .block();
        } catch (WebClientException e) {
            throw new AnalysisUnavailableException("Analysis service call failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new AnalysisUnavailableException("Analysis service did not answer within " + settings.getTimeout(), e);
        }

        String content = response == null ? null
                : response.path("choices").path(0).path("message").path("content").asText(null);
        if (!StringUtils.hasText(content)) {
            throw new AnalysisUnavailableException("Analysis service returned an empty answer");
        }
        return parse(content);
    }

    ArtworkAnalysis parse(String content) {
        JsonNode node;
        try {
            node = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            return fromProse(content);
        }
        if (node == null || !node.isObject()) {
            return fromProse(content);
        }

        ArtworkAnalysis.ArtworkAnalysisBuilder builder = ArtworkAnalysis.builder()
                .artwork(node.path("is_artwork").asBoolean(true))
                .label(textOrDefault(node, "title", UNKNOWN_TITLE))
                .artist(textOrDefault(node, "artist", null))
                .description(textOrDefault(node, "description", null))
                .confidence(confidenceOf(node.get("confidence")));
        for (String key : List.of("style", "era", "medium")) {
            String value = textOrDefault(node, key, null);
            if (value != null) {
                builder.detail(key, value);
            }
        }
        return builder.build();
    }

    /** The model ignored the JSON instruction; fall back to reading its prose. */
    private static ArtworkAnalysis fromProse(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        boolean notArt = lower.contains("not an artwork") || lower.contains("not artwork");
        return ArtworkAnalysis.builder()
                .artwork(!notArt)
                .label(UNKNOWN_TITLE)
                .description(content)
                .build();
    }

    private static String textOrDefault(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !StringUtils.hasText(value.asText())) {
            return fallback;
        }
        String text = value.asText().trim();
        return "unknown".equalsIgnoreCase(text) ? fallback : text;
    }

    private static Double confidenceOf(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        switch (value.asText().trim().toLowerCase(Locale.ROOT)) {
            case "high":
                return 0.9;
            case "medium":
                return 0.6;
            case "low":
                return 0.3;
            default:
                return null;
        }
    }
}
