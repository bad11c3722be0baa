package com.backend.artscan.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * One completed scan. Rows are only ever appended.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table(name = "user_scans", uniqueConstraints = {
        @UniqueConstraint(name = "uk_user_scans_user_scanned_at", columnNames = {"user_id", "scanned_at"})
}, indexes = {
        @Index(name = "idx_user_scans_user_id", columnList = "user_id"),
        @Index(name = "idx_user_scans_scanned_at", columnList = "scanned_at")
})
public class ScanEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "scan_id")
    private Long scanId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    /** Null when the subject was not an artwork, or after the artwork was removed by moderation. */
    @Column(name = "artwork_id")
    private Long artworkId;

    @Column(name = "image_url", length = 1024)
    private String imageUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ScanStatus status;

    @Column(name = "scanned_at", nullable = false)
    private Instant scannedAt;
}
