package com.backend.artscan.dto;

import com.backend.artscan.model.ScanEvent;
import com.backend.artscan.model.ScanStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanEventDto {
    private Long scanId;
    private String userId;
    private Long artworkId;
    private String imageUrl;
    private ScanStatus status;
    private Instant timestamp;

    public static ScanEventDto fromModel(ScanEvent event) {
        return new ScanEventDto(event.getScanId(), event.getUserId(), event.getArtworkId(),
                event.getImageUrl(), event.getStatus(), event.getScannedAt());
    }
}
