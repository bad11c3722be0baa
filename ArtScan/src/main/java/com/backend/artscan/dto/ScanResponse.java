package com.backend.artscan.dto;

import com.backend.artscan.model.ScanResult;
import com.backend.artscan.model.ScanStatus;
import com.backend.artscan.util.DescriptionJson;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanResponse {
    private ScanStatus status;
    private ArtworkDto artwork;
    private AnalysisDto analysis;
    private String message;
    private boolean cataloged;
    /** True when the returned description comes from the generative model rather than the catalog. */
    private boolean aiGenerated;
    private Long scanId;

    public static ScanResponse fromModel(ScanResult result, DescriptionJson descriptionJson) {
        return ScanResponse.builder()
                .status(result.getStatus())
                .artwork(ArtworkDto.fromModel(result.getArtwork(), result.getDistance(), descriptionJson))
                .analysis(AnalysisDto.fromModel(result.getAnalysis()))
                .message(result.getMessage())
                .cataloged(result.isCataloged())
                .aiGenerated(result.getStatus() == ScanStatus.AI_ANALYSIS)
                .scanId(result.getScanId())
                .build();
    }
}
