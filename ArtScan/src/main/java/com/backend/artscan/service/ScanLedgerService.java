package com.backend.artscan.service;

import com.backend.artscan.exception.StoreConflictException;
import com.backend.artscan.model.ScanEvent;
import com.backend.artscan.model.ScanStatus;
import com.backend.artscan.repository.ScanEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Append-only log of completed scans. Timestamps are strictly increasing per user.
 * <p>
 * The previous timestamp is read from the store on every write, so events recorded by other nodes are
 * honoured. The unique (user_id, scanned_at) constraint catches the cross-node race; the losing write
 * re-reads and retries.
 */
@Slf4j
@Service
public class ScanLedgerService {

    static final int LOCK_STRIPES = 64;
    static final int MAX_ATTEMPTS = 3;

    private final ScanEventRepository scanEventRepository;
    private final TransactionTemplate transactionTemplate;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public ScanLedgerService(ScanEventRepository scanEventRepository, PlatformTransactionManager transactionManager) {
        this.scanEventRepository = scanEventRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    public ScanEvent record(String userId, Long artworkId, String imageUrl, ScanStatus status) {
        synchronized (locks[Math.floorMod(userId.hashCode(), LOCK_STRIPES)]) {
            DataIntegrityViolationException lastConflict = null;
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                try {
                    ScanEvent saved = transactionTemplate.execute(tx -> append(userId, artworkId, imageUrl, status));
                    log.debug("Recorded scan {} for user {}: {} -> artwork {}",
                            saved.getScanId(), userId, status, artworkId);
                    return saved;
                } catch (DataIntegrityViolationException e) {
                    log.warn("Scan timestamp for user {} collided on attempt {}/{}", userId, attempt, MAX_ATTEMPTS);
                    lastConflict = e;
                }
            }
            throw new StoreConflictException("Could not record scan for user " + userId, lastConflict);
        }
    }

    public Page<ScanEvent> history(String userId, int page, int size) {
        return scanEventRepository.findByUserIdOrderByScannedAtDesc(userId, PageRequest.of(page, size));
    }

    private ScanEvent append(String userId, Long artworkId, String imageUrl, ScanStatus status) {
        Instant previous = scanEventRepository.findFirstByUserIdOrderByScannedAtDesc(userId)
                .map(ScanEvent::getScannedAt)
                .orElse(null);
        return scanEventRepository.saveAndFlush(ScanEvent.builder()
                .userId(userId)
                .artworkId(artworkId)
                .imageUrl(imageUrl)
                .status(status)
                .scannedAt(nextTimestamp(previous))
                .build());
    }

    static Instant nextTimestamp(Instant previous) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        if (previous != null && !now.isAfter(previous)) {
            return previous.truncatedTo(ChronoUnit.MICROS).plus(1, ChronoUnit.MICROS);
        }
        return now;
    }
}
