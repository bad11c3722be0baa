package com.backend.artscan.controller;

import com.backend.artscan.TestImages;
import com.backend.artscan.client.EmbeddingModel;
import com.backend.artscan.client.VisionAnalyzer;
import com.backend.artscan.exception.EmbeddingUnavailableException;
import com.backend.artscan.model.ArtworkAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.awt.Color;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
public class ScanControllerTest {

    @LocalServerPort
    private int port;

    private WebTestClient webTestClient;

    @MockBean
    private EmbeddingModel embeddingModel;

    @MockBean
    private VisionAnalyzer visionAnalyzer;

    @Autowired
    public void setWebTestClient() {
        this.webTestClient = WebTestClient.bindToServer().baseUrl("http://localhost:" + port).build();
    }

    @BeforeEach
    public void setUp() {
        when(embeddingModel.embed(any(), any()))
                .thenAnswer(invocation -> TestImages.embeddingOf(invocation.getArgument(0)));
        when(visionAnalyzer.analyze(any(), any())).thenReturn(ArtworkAnalysis.builder()
                .artwork(true)
                .label("Composition in Orange")
                .description("Flat orange field.")
                .detail("style", "Minimalism")
                .confidence(0.4)
                .build());
    }

    private static MultipartBodyBuilder scanForm(byte[] image, String userId) {
        MultipartBodyBuilder bodyBuilder = new MultipartBodyBuilder();
        bodyBuilder.part("image", new ByteArrayResource(image) {
            @Override
            public String getFilename() {
                return "scan.png";
            }
        }).contentType(MediaType.IMAGE_PNG);
        bodyBuilder.part("latitude", "-33.8568");
        bodyBuilder.part("longitude", "151.2153");
        if (userId != null) {
            bodyBuilder.part("user_id", userId);
        }
        return bodyBuilder;
    }

    @Test
    public void testScanCataloguesUnknownArtwork() {
        webTestClient.post()
                .uri("/api/scan")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .bodyValue(scanForm(TestImages.png(Color.ORANGE), "http-user").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ai_analysis")
                .jsonPath("$.cataloged").isEqualTo(true)
                .jsonPath("$.ai_generated").isEqualTo(true)
                .jsonPath("$.scan_id").exists()
                .jsonPath("$.artwork.title").isEqualTo("Composition in Orange")
                .jsonPath("$.artwork.is_verified").isEqualTo(false)
                .jsonPath("$.artwork.source").isEqualTo("ai_generated")
                .jsonPath("$.artwork.description.style").isEqualTo("Minimalism")
                .jsonPath("$.artwork.description.ai_generated").isEqualTo(true);

        webTestClient.get()
                .uri("/api/scan/history?user_id=http-user")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].status").isEqualTo("ai_analysis")
                .jsonPath("$[0].user_id").isEqualTo("http-user");
    }

    @Test
    public void testScanRejectsUndecodableImage() {
        webTestClient.post()
                .uri("/api/scan")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .bodyValue(scanForm("not really a png".getBytes(), null).build())
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.retryable").isEqualTo(false);
    }

    @Test
    public void testScanRequiresCoordinates() {
        MultipartBodyBuilder bodyBuilder = new MultipartBodyBuilder();
        bodyBuilder.part("image", new ByteArrayResource(TestImages.png(Color.PINK)) {
            @Override
            public String getFilename() {
                return "scan.png";
            }
        }).contentType(MediaType.IMAGE_PNG);

        webTestClient.post()
                .uri("/api/scan")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .bodyValue(bodyBuilder.build())
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    public void testEmbeddingOutageIsRetryable() {
        when(embeddingModel.embed(any(), any())).thenThrow(new EmbeddingUnavailableException("model offline"));

        webTestClient.post()
                .uri("/api/scan")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .bodyValue(scanForm(TestImages.png(Color.DARK_GRAY), "http-user").build())
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.retryable").isEqualTo(true);
    }

    @Test
    public void testReportIssueAgainstUnknownArtwork() {
        webTestClient.post()
                .uri("/api/report-issue")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"artwork_id\": 987654, \"user_id\": \"u1\", \"issue_type\": \"wrong_title\"}")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.accepted").isEqualTo(false);
    }

    @Test
    public void testHealth() {
        webTestClient.get()
                .uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy");

        webTestClient.get()
                .uri("/")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Museum Art Scanner API");
    }
}
