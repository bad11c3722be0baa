package com.backend.artscan.dto;

import com.backend.artscan.model.IssueKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueReportRequest {
    @NotNull(message = "Artwork ID is required")
    private Long artworkId;

    private String userId;

    @NotNull(message = "Issue type is required")
    private IssueKind issueType;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;
}
