package com.backend.artscan.repository;

import com.backend.artscan.model.CatalogLease;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface CatalogLeaseRepository extends JpaRepository<CatalogLease, String> {

    @Modifying
    @Query("delete from CatalogLease l where l.bucket = :bucket and l.owner = :owner")
    int release(@Param("bucket") String bucket, @Param("owner") String owner);

    @Modifying
    @Query("delete from CatalogLease l where l.bucket = :bucket and l.acquiredAt < :cutoff")
    int expire(@Param("bucket") String bucket, @Param("cutoff") Instant cutoff);
}
