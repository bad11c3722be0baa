package com.backend.artscan.service;

import com.backend.artscan.config.ArtScanProperties;
import com.backend.artscan.exception.StoreConflictException;
import com.backend.artscan.model.CatalogLease;
import com.backend.artscan.repository.CatalogLeaseRepository;
import com.backend.artscan.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.UUID;

/**
 * Store-level guard across nodes: a lease row keyed by a coarse hyperplane bucket of the embedding.
 * Inserting a lease that another node holds violates the primary key and surfaces as
 * {@link StoreConflictException}.
 */
@Slf4j
@Service
public class CatalogLeaseService {

    private final CatalogLeaseRepository leaseRepository;
    private final TransactionTemplate transactionTemplate;
    private final ArtScanProperties.Catalog settings;
    private final String owner = UUID.randomUUID().toString();

    public CatalogLeaseService(CatalogLeaseRepository leaseRepository,
                               PlatformTransactionManager transactionManager,
                               ArtScanProperties properties) {
        this.leaseRepository = leaseRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.settings = properties.getCatalog();
    }

    public String bucketOf(float[] embedding) {
        return VectorMath.hyperplaneBucket(embedding, settings.getBucketBits(), settings.getBucketSeed());
    }

    public void acquire(String bucket) {
        Instant now = Instant.now();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                int expired = leaseRepository.expire(bucket, now.minus(settings.getLeaseTtl()));
                if (expired > 0) {
                    log.warn("Took over abandoned catalog lease for bucket {}", bucket);
                }
            });
            transactionTemplate.executeWithoutResult(status ->
                    leaseRepository.saveAndFlush(new CatalogLease(bucket, owner, now)));
        } catch (DataIntegrityViolationException e) {
            throw new StoreConflictException("Catalog lease for bucket " + bucket + " is held elsewhere", e);
        }
    }

    public void release(String bucket) {
        transactionTemplate.executeWithoutResult(status -> leaseRepository.release(bucket, owner));
    }
}
