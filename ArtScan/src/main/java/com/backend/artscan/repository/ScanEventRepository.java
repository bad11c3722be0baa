package com.backend.artscan.repository;

import com.backend.artscan.model.ScanEvent;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ScanEventRepository extends JpaRepository<ScanEvent, Long> {

    Page<ScanEvent> findByUserIdOrderByScannedAtDesc(String userId, Pageable pageable);

    Optional<ScanEvent> findFirstByUserIdOrderByScannedAtDesc(String userId);

    long countByArtworkId(Long artworkId);

    long countByArtworkIdIsNull();

    @Modifying
    @Query("update ScanEvent s set s.artworkId = null where s.artworkId = :artworkId")
    int clearArtworkReference(@Param("artworkId") Long artworkId);
}
