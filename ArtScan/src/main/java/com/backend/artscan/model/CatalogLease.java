package com.backend.artscan.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Held while a node runs the check-then-insert sequence for one embedding bucket.
 * The primary key makes a second concurrent holder fail on insert.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "catalog_leases")
public class CatalogLease implements Persistable<String> {

    @Id
    @Column(name = "bucket", length = 64)
    private String bucket;

    @Column(name = "owner", nullable = false, length = 64)
    private String owner;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Override
    public String getId() {
        return bucket;
    }

    /** Always inserted, never merged, so a held lease fails with a duplicate key. */
    @Override
    public boolean isNew() {
        return true;
    }
}
