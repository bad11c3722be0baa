package com.backend.artscan.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Policy constants and collaborator endpoints for the scan pipeline.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "artscan")
public class ArtScanProperties {

    private final Match match = new Match();
    private final Embedding embedding = new Embedding();
    private final Analysis analysis = new Analysis();
    private final Catalog catalog = new Catalog();
    private final Storage storage = new Storage();

    @Getter
    @Setter
    public static class Match {
        /** Candidates are accepted only strictly below this cosine distance. */
        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double distanceThreshold = 0.15;

        /** How many nearest neighbours the similarity index returns per query. */
        @Min(1)
        private int candidateLimit = 5;

        /** Report every match as match_found, for clients predating the tier statuses. */
        private boolean legacyStatus = false;
    }

    @Getter
    @Setter
    public static class Embedding {
        @Min(1)
        private int dimension = 512;
        private String url = "http://localhost:8001";
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Analysis {
        private String baseUrl = "https://api.openai.com";
        private String apiKey = "";
        private String model = "gpt-4o-mini";
        private int maxTokens = 500;
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Catalog {
        /** Number of random hyperplanes used for the coarse lease bucket. */
        @Min(1)
        private int bucketBits = 12;
        private long bucketSeed = 0x5EEDL;
        /** Leases older than this are considered abandoned and may be taken over. */
        private Duration leaseTtl = Duration.ofSeconds(30);
        @Min(1)
        private int conflictAttempts = 10;
        private Duration conflictBackoff = Duration.ofMillis(100);
        /** Upper bound on waiting for a competing in-flight insert. */
        private Duration claimWait = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Storage {
        private String directory = "./data/images";
        private String publicBaseUrl = "http://localhost:8080/images";
    }
}
