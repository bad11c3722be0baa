package com.backend.artscan.dto;

import com.backend.artscan.model.IssueKind;
import com.backend.artscan.model.IssueReport;
import com.backend.artscan.model.IssueState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IssueReportDto {
    private Long id;
    private Long artworkId;
    private String userId;
    private IssueKind kind;
    private String note;
    private IssueState state;
    private String resolvedBy;
    private String resolutionNote;
    private Instant createdAt;
    private Instant resolvedAt;

    public static IssueReportDto fromModel(IssueReport report) {
        if (report == null)
            return null;
        return IssueReportDto.builder()
                .id(report.getId())
                .artworkId(report.getArtworkId())
                .userId(report.getUserId())
                .kind(report.getKind())
                .note(report.getNote())
                .state(report.getState())
                .resolvedBy(report.getResolvedBy())
                .resolutionNote(report.getResolutionNote())
                .createdAt(report.getCreatedAt())
                .resolvedAt(report.getResolvedAt())
                .build();
    }
}
