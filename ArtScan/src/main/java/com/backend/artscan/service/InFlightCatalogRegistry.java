package com.backend.artscan.service;

import com.backend.artscan.util.VectorMath;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Keyed mutual exclusion for the check-then-insert sequence on this node. Two claims conflict when their
 * embeddings are closer than the match threshold, so at most one insert per subject is in flight.
 */
@Component
public class InFlightCatalogRegistry {

    private final List<Claim> inFlight = new ArrayList<>();

    /**
     * Registers a claim for {@code embedding}, or returns the conflicting claim already in flight.
     */
    public synchronized Claim claim(float[] embedding, double threshold) {
        for (Claim existing : inFlight) {
            if (VectorMath.cosineDistance(existing.embedding, embedding) < threshold) {
                return new Claim(existing.embedding, existing.done, false);
            }
        }
        Claim claim = new Claim(embedding, new CountDownLatch(1), true);
        inFlight.add(claim);
        return claim;
    }

    public synchronized void release(Claim claim) {
        if (!claim.owner) {
            return;
        }
        inFlight.removeIf(c -> c.done == claim.done);
        claim.done.countDown();
    }

    /**
     * Blocks until the owner of a conflicting claim releases it.
     *
     * @return false if {@code timeout} elapsed first
     */
    public boolean await(Claim claim, Duration timeout) throws InterruptedException {
        return claim.done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    synchronized int size() {
        return inFlight.size();
    }

    public static final class Claim {
        private final float[] embedding;
        private final CountDownLatch done;
        private final boolean owner;

        private Claim(float[] embedding, CountDownLatch done, boolean owner) {
            this.embedding = embedding;
            this.done = done;
            this.owner = owner;
        }

        public boolean isOwner() {
            return owner;
        }
    }
}
