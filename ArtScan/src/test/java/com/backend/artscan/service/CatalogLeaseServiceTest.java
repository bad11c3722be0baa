package com.backend.artscan.service;

import com.backend.artscan.config.ArtScanProperties;
import com.backend.artscan.exception.StoreConflictException;
import com.backend.artscan.repository.CatalogLeaseRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({CatalogLeaseService.class, CatalogLeaseServiceTest.Config.class})
public class CatalogLeaseServiceTest {

    @TestConfiguration
    @EnableConfigurationProperties(ArtScanProperties.class)
    static class Config {
    }

    @Autowired
    private CatalogLeaseService leaseService;

    @Autowired
    private CatalogLeaseRepository leaseRepository;

    @Test
    public void secondHolderOfABucketConflicts() {
        leaseService.acquire("bucket-a");
        try {
            assertThatThrownBy(() -> leaseService.acquire("bucket-a"))
                    .isInstanceOf(StoreConflictException.class);
        } finally {
            leaseService.release("bucket-a");
        }
        assertThat(leaseRepository.existsById("bucket-a")).isFalse();
    }

    @Test
    public void releasedBucketCanBeTakenAgain() {
        leaseService.acquire("bucket-b");
        leaseService.release("bucket-b");

        leaseService.acquire("bucket-b");
        leaseService.release("bucket-b");
        assertThat(leaseRepository.count()).isZero();
    }

    @Test
    public void identicalEmbeddingsShareABucket() {
        float[] embedding = {0.1f, 0.2f, 0.3f};
        assertThat(leaseService.bucketOf(embedding)).isEqualTo(leaseService.bucketOf(embedding.clone()));
    }
}
