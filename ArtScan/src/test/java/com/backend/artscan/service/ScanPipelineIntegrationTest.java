package com.backend.artscan.service;

import com.backend.artscan.TestImages;
import com.backend.artscan.client.EmbeddingModel;
import com.backend.artscan.client.VisionAnalyzer;
import com.backend.artscan.model.Artwork;
import com.backend.artscan.model.ArtworkAnalysis;
import com.backend.artscan.model.ArtworkSource;
import com.backend.artscan.model.CatalogOutcome;
import com.backend.artscan.model.CatalogRequest;
import com.backend.artscan.model.GeofenceScope;
import com.backend.artscan.model.Museum;
import com.backend.artscan.model.ScanResult;
import com.backend.artscan.model.ScanStatus;
import com.backend.artscan.repository.ArtworkRepository;
import com.backend.artscan.repository.ScanEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
public class ScanPipelineIntegrationTest {

    private static final double LOUVRE_LAT = 48.8606;
    private static final double LOUVRE_LON = 2.3376;
    // roughly 0.000009 degrees of latitude per metre
    private static final double METRE_LAT = 1.0 / 111_195;

    @MockBean
    private EmbeddingModel embeddingModel;

    @MockBean
    private VisionAnalyzer visionAnalyzer;

    @Autowired
    private ScanService scanService;

    @Autowired
    private CatalogAdminService catalogAdminService;

    @Autowired
    private AutoCatalogService autoCatalogService;

    @Autowired
    private ArtworkRepository artworkRepository;

    @Autowired
    private ScanEventRepository scanEventRepository;

    @BeforeEach
    public void setUp() {
        when(embeddingModel.embed(any(), any()))
                .thenAnswer(invocation -> TestImages.embeddingOf(invocation.getArgument(0)));
        when(visionAnalyzer.analyze(any(), any())).thenAnswer(invocation -> {
            Color color = TestImages.colorOf(invocation.getArgument(0));
            if (Color.GREEN.equals(color)) {
                return ArtworkAnalysis.builder().artwork(false).build();
            }
            // widen the window in which concurrent first scans overlap
            Thread.sleep(200);
            return ArtworkAnalysis.builder()
                    .artwork(true)
                    .label("Untitled Study")
                    .artist("Unknown painter")
                    .description("An abstract colour field.")
                    .detail("style", "Colour Field")
                    .confidence(0.55)
                    .build();
        });
    }

    private ScanResult scan(Color color, double lat, double lon, String user) {
        return scanService.submitScan(TestImages.png(color), "image/png", "scan.png", lat, lon, user);
    }

    @Test
    public void knownVerifiedArtworkIsReturnedWithoutCataloguing() {
        Artwork seeded = catalogAdminService.createVerifiedArtwork(TestImages.png(Color.RED), "image/png",
                "red.png", "Red Square", "Kazimir Malevich", Map.of("year", "1915"), null, ArtworkSource.MUSEUM_API);
        long artworksBefore = artworkRepository.count();

        ScanResult result = scan(Color.RED, 10.0, 10.0, "alice");

        assertThat(result.getStatus()).isEqualTo(ScanStatus.VERIFIED_RESULT);
        assertThat(result.getArtwork().getId()).isEqualTo(seeded.getId());
        assertThat(result.getDistance()).isLessThan(1e-6);
        assertThat(artworkRepository.count()).isEqualTo(artworksBefore);
        verify(visionAnalyzer, times(0)).analyze(any(), any());
    }

    @Test
    public void notArtIsLoggedButNeverCatalogued() {
        long artworksBefore = artworkRepository.count();
        long unlinkedBefore = scanEventRepository.countByArtworkIdIsNull();

        ScanResult result = scan(Color.GREEN, 10.0, 10.0, "bob");

        assertThat(result.getStatus()).isEqualTo(ScanStatus.NOT_ART);
        assertThat(result.getArtwork()).isNull();
        assertThat(artworkRepository.count()).isEqualTo(artworksBefore);
        assertThat(scanEventRepository.countByArtworkIdIsNull()).isEqualTo(unlinkedBefore + 1);
    }

    @Test
    public void firstScanCataloguesAndSecondScanFindsCommunityEntry() {
        ScanResult first = scan(Color.BLUE, 10.0, 10.0, "carol");

        assertThat(first.getStatus()).isEqualTo(ScanStatus.AI_ANALYSIS);
        assertThat(first.isCataloged()).isTrue();
        Artwork created = first.getArtwork();
        assertThat(created.isVerified()).isFalse();
        assertThat(created.getSource()).isEqualTo(ArtworkSource.AI_GENERATED);
        assertThat(created.getConfidenceScore()).isEqualTo(0.55);

        ScanResult second = scan(Color.BLUE, 10.0, 10.0, "dave");

        assertThat(second.getStatus()).isEqualTo(ScanStatus.COMMUNITY_RESULT);
        assertThat(second.getArtwork().getId()).isEqualTo(created.getId());
        assertThat(second.getDistance()).isLessThan(1e-6);
        assertThat(second.isCataloged()).isFalse();
        verify(visionAnalyzer, times(1)).analyze(any(), any());
    }

    @Test
    public void concurrentFirstScansCreateExactlyOneArtwork() throws Exception {
        long artworksBefore = artworkRepository.count();
        long eventsBefore = scanEventRepository.count();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<ScanResult>> futures = List.of(
                    executor.submit(() -> {
                        start.await();
                        return scan(Color.YELLOW, 10.0, 10.0, "erin");
                    }),
                    executor.submit(() -> {
                        start.await();
                        return scan(Color.YELLOW, 10.0, 10.0, "frank");
                    }));
            start.countDown();

            List<ScanResult> results = new ArrayList<>();
            for (Future<ScanResult> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }

            assertThat(artworkRepository.count()).isEqualTo(artworksBefore + 1);
            assertThat(scanEventRepository.count()).isEqualTo(eventsBefore + 2);
            assertThat(results.stream().map(r -> r.getArtwork().getId()).collect(Collectors.toSet())).hasSize(1);
            assertThat(results).extracting(ScanResult::getStatus)
                    .containsExactlyInAnyOrder(ScanStatus.AI_ANALYSIS, ScanStatus.COMMUNITY_RESULT);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void concurrentCatalogOfNearbyEmbeddingsCreatesOneRow() throws Exception {
        // close to each other, orthogonal to every colour embedding
        float[] first = {0, 0, 0, 0, 1, 0.20f, 0, 0};
        float[] second = {0, 0, 0, 0, 1, 0.25f, 0, 0};
        long artworksBefore = artworkRepository.count();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<CatalogOutcome>> futures = List.of(
                    executor.submit(() -> {
                        start.await();
                        return autoCatalogService.getOrCreate(catalogRequest(first));
                    }),
                    executor.submit(() -> {
                        start.await();
                        return autoCatalogService.getOrCreate(catalogRequest(second));
                    }));
            start.countDown();

            List<CatalogOutcome> outcomes = new ArrayList<>();
            for (Future<CatalogOutcome> future : futures) {
                outcomes.add(future.get(30, TimeUnit.SECONDS));
            }

            assertThat(artworkRepository.count()).isEqualTo(artworksBefore + 1);
            assertThat(outcomes.get(0).getArtwork().getId()).isEqualTo(outcomes.get(1).getArtwork().getId());
            assertThat(outcomes).extracting(CatalogOutcome::isCreated).containsExactlyInAnyOrder(true, false);
        } finally {
            executor.shutdownNow();
        }
    }

    private static CatalogRequest catalogRequest(float[] embedding) {
        return CatalogRequest.builder()
                .embedding(embedding)
                .title("Nocturne")
                .description(Map.of("style", "Tonalism"))
                .confidence(0.5)
                .scope(GeofenceScope.empty())
                .build();
    }

    @Test
    public void geofenceDecidesWhetherMuseumArtworkIsVisible() {
        Museum louvre = catalogAdminService.createMuseum(Museum.builder().name("Louvre")
                .latitude(LOUVRE_LAT).longitude(LOUVRE_LON).geofenceRadiusMeters(200).build());
        Artwork piece = catalogAdminService.createVerifiedArtwork(TestImages.png(Color.MAGENTA), "image/png",
                "magenta.png", "Liberty Leading the People", "Eugene Delacroix", null, louvre.getId(), null);

        ScanResult inside = scan(Color.MAGENTA, LOUVRE_LAT + 100 * METRE_LAT, LOUVRE_LON, "gina");

        assertThat(inside.getStatus()).isEqualTo(ScanStatus.VERIFIED_RESULT);
        assertThat(inside.getArtwork().getId()).isEqualTo(piece.getId());

        ScanResult outside = scan(Color.MAGENTA, LOUVRE_LAT + 250 * METRE_LAT, LOUVRE_LON, "gina");

        assertThat(outside.getStatus()).isEqualTo(ScanStatus.AI_ANALYSIS);
        assertThat(outside.getArtwork().getId()).isNotEqualTo(piece.getId());
        assertThat(outside.getArtwork().getMuseum()).isNull();
    }
}
